package com.spotify.confidence.grpc.interceptor;

import com.google.common.collect.ImmutableList;
import com.spotify.confidence.grpc.Exceptions.InterceptorException;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.ClientInterceptors;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.Status;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An immutable, ordered list of {@link Interceptor}s applied to every outgoing call.
 *
 * <p>Interceptors run in the order they were given, all of them on every call, so when two write
 * the same header the later one wins. The first failure aborts the call before it reaches the
 * transport: the caller sees {@code UNAUTHENTICATED} (or {@code CANCELLED} when resolution was
 * interrupted) with the {@link InterceptorException} as cause. An empty chain leaves calls
 * untouched.
 *
 * <pre>{@code
 * InterceptorChain chain =
 *     InterceptorChain.of(
 *         new ApiKeyInterceptor(apiKey), new BearerTokenInterceptor(tokenHolder::currentToken));
 * Channel authenticated = chain.bind(channel);
 * }</pre>
 */
public final class InterceptorChain implements ClientInterceptor {
  private static final Logger logger = LoggerFactory.getLogger(InterceptorChain.class);
  private static final InterceptorChain EMPTY = new InterceptorChain(ImmutableList.of());

  private final ImmutableList<Interceptor> interceptors;

  private InterceptorChain(ImmutableList<Interceptor> interceptors) {
    this.interceptors = interceptors;
  }

  public static InterceptorChain empty() {
    return EMPTY;
  }

  /**
   * Creates a chain applying {@code interceptors} in the given order.
   *
   * @throws NullPointerException if any interceptor is null
   */
  public static InterceptorChain of(Interceptor... interceptors) {
    return new InterceptorChain(ImmutableList.copyOf(interceptors));
  }

  public static InterceptorChain of(List<? extends Interceptor> interceptors) {
    return new InterceptorChain(ImmutableList.copyOf(interceptors));
  }

  public List<Interceptor> interceptors() {
    return interceptors;
  }

  public int size() {
    return interceptors.size();
  }

  public boolean isEmpty() {
    return interceptors.isEmpty();
  }

  /**
   * Runs every interceptor, in order, against {@code headers}.
   *
   * @throws InterceptorException from the first interceptor that fails; later ones do not run
   */
  public void apply(Metadata headers) throws InterceptorException {
    for (Interceptor interceptor : interceptors) {
      interceptor.intercept(headers);
    }
  }

  /** Wraps {@code channel} so that every call made through it passes through this chain. */
  public Channel bind(Channel channel) {
    return ClientInterceptors.intercept(channel, this);
  }

  @Override
  public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
      MethodDescriptor<ReqT, RespT> method, CallOptions callOptions, Channel next) {
    if (interceptors.isEmpty()) {
      return next.newCall(method, callOptions);
    }
    return new ClientInterceptors.CheckedForwardingClientCall<ReqT, RespT>(
        next.newCall(method, callOptions)) {
      @Override
      protected void checkedStart(Listener<RespT> responseListener, Metadata headers) {
        try {
          apply(headers);
        } catch (InterceptorException e) {
          logger.debug(
              "Aborting call to {}: {} failed", method.getFullMethodName(), e.interceptor());
          final Status status = e.isCancelled() ? Status.CANCELLED : Status.UNAUTHENTICATED;
          throw status.withDescription(e.getMessage()).withCause(e).asRuntimeException();
        }
        delegate().start(responseListener, headers);
      }
    };
  }

  @Override
  public String toString() {
    return "InterceptorChain" + interceptors;
  }
}
