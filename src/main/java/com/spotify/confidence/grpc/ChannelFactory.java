package com.spotify.confidence.grpc;

import com.spotify.confidence.grpc.Exceptions.ChannelEstablishmentException;
import com.spotify.confidence.grpc.Exceptions.InvalidConfigurationException;
import com.spotify.confidence.grpc.interceptor.InterceptorChain;
import io.grpc.ManagedChannel;
import java.util.concurrent.CompletableFuture;

/**
 * ChannelFactory establishes gRPC channels secured by a {@link TlsConfig} towards an {@link
 * Endpoint}. Authentication is not part of the channel itself; it is layered on with an {@link
 * InterceptorChain}.
 *
 * <p>Implementations may replace the channel creation mechanism entirely. This is particularly
 * useful for:
 *
 * <ul>
 *   <li>Unit testing: return in-process channels backed by mock servers
 *   <li>Production customization: proxies, custom executors, connection pooling
 *   <li>Debugging: add logging or tracing interceptors
 * </ul>
 */
@FunctionalInterface
public interface ChannelFactory {

  /**
   * Establishes a channel that runs {@code interceptors} on every call.
   *
   * <p>The returned future fails with {@link InvalidConfigurationException} when the TLS material
   * cannot be turned into credentials, and with {@link ChannelEstablishmentException} when the
   * transport cannot be built or the connection cannot be set up. Cancelling the future releases
   * any partially built channel.
   *
   * @param tls how to secure the transport
   * @param endpoint the target to connect to
   * @param interceptors applied, in order, to every outgoing call
   * @return a future completed with a usable channel
   */
  CompletableFuture<ManagedChannel> channel(
      TlsConfig tls, Endpoint endpoint, InterceptorChain interceptors);

  /** Establishes a channel without interceptors. */
  default CompletableFuture<ManagedChannel> channel(TlsConfig tls, Endpoint endpoint) {
    return channel(tls, endpoint, InterceptorChain.empty());
  }
}
