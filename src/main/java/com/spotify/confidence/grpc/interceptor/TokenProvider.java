package com.spotify.confidence.grpc.interceptor;

/**
 * Supplies the current bearer token for {@link BearerTokenInterceptor}.
 *
 * <p>Called once per outgoing call, on the thread that starts the call. Implementations may block
 * (for example to refresh an expired token) and must be thread-safe; any caching or refresh
 * synchronization is the provider's responsibility.
 */
@FunctionalInterface
public interface TokenProvider {

  /**
   * Returns the token to send.
   *
   * @return the current token, without the {@code Bearer} prefix
   * @throws Exception if the token cannot be obtained
   */
  String token() throws Exception;
}
