package com.spotify.confidence.grpc.interceptor;

import com.spotify.confidence.grpc.Exceptions.InterceptorException;
import io.grpc.Metadata;

/**
 * Decorates the metadata of an outgoing call before it leaves the process.
 *
 * <p>Implementations add or overwrite only the entries they own and must be safe to invoke
 * concurrently for different calls. Compose them with {@link InterceptorChain}.
 */
@FunctionalInterface
public interface Interceptor {

  /**
   * Applies this interceptor to the headers of one outgoing call.
   *
   * @param headers the mutable request metadata
   * @throws InterceptorException if the credential is missing or cannot be resolved; the call is
   *     aborted before transmission
   */
  void intercept(Metadata headers) throws InterceptorException;
}
