package com.spotify.confidence.grpc;

import com.google.common.annotations.VisibleForTesting;
import com.spotify.confidence.grpc.Exceptions.ChannelEstablishmentException;
import com.spotify.confidence.grpc.Exceptions.InvalidConfigurationException;
import com.spotify.confidence.grpc.interceptor.InterceptorChain;
import io.grpc.ChannelCredentials;
import io.grpc.ClientInterceptor;
import io.grpc.ConnectivityState;
import io.grpc.InsecureChannelCredentials;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default implementation of ChannelFactory backed by the grpc-java transport registered on the
 * classpath.
 *
 * <p>This factory:
 *
 * <ul>
 *   <li>Uses TLS credentials from the {@link TlsConfig} for https endpoints, plaintext for http
 *   <li>Honors the server name override as the channel authority
 *   <li>Sends keep-alive pings, also while idle, and a library user agent
 *   <li>Applies the interceptor chain followed by a default deadline interceptor
 *   <li>Waits until the channel is READY, unless configured to connect lazily
 * </ul>
 *
 * <p>The factory owns no threads. Connection progress is observed through channel state callbacks
 * and the connect timeout runs on {@link CompletableFuture#orTimeout}.
 */
public class DefaultChannelFactory implements ChannelFactory {
  private static final Logger logger = LoggerFactory.getLogger(DefaultChannelFactory.class);

  private final ChannelOptions options;
  private final ChannelBuilderProvider builderProvider;

  public DefaultChannelFactory() {
    this(ChannelOptions.fromEnvironment());
  }

  public DefaultChannelFactory(ChannelOptions options) {
    this(options, ChannelBuilderProvider.DEFAULT);
  }

  @VisibleForTesting
  DefaultChannelFactory(ChannelOptions options, ChannelBuilderProvider builderProvider) {
    this.options = Objects.requireNonNull(options, "options");
    this.builderProvider = Objects.requireNonNull(builderProvider, "builderProvider");
  }

  public ChannelOptions options() {
    return options;
  }

  @Override
  public CompletableFuture<ManagedChannel> channel(
      TlsConfig tls, Endpoint endpoint, InterceptorChain interceptors) {
    Objects.requireNonNull(tls, "tls");
    Objects.requireNonNull(endpoint, "endpoint");
    Objects.requireNonNull(interceptors, "interceptors");

    final ChannelCredentials credentials;
    try {
      credentials = credentialsFor(tls, endpoint);
    } catch (InvalidConfigurationException e) {
      return CompletableFuture.failedFuture(e);
    }

    final ManagedChannelBuilder<?> builder;
    try {
      builder = builderProvider.builderFor(endpoint.target(), credentials);
    } catch (RuntimeException e) {
      // The transport validates credentials when it creates the builder
      logger.warn("Transport rejected channel configuration for {}", endpoint, e);
      return CompletableFuture.failedFuture(
          new InvalidConfigurationException(
              "Transport rejected channel configuration for " + endpoint, e));
    }

    final ManagedChannel channel;
    try {
      channel = build(builder, tls, interceptors);
    } catch (RuntimeException e) {
      logger.warn("Failed to build transport for {}", endpoint, e);
      return CompletableFuture.failedFuture(
          new ChannelEstablishmentException(endpoint, "Failed to build transport", e));
    }

    if (options.connectLazily()) {
      logger.debug("Created lazy channel to {}", endpoint);
      return CompletableFuture.completedFuture(channel);
    }
    return connect(channel, endpoint);
  }

  private static ChannelCredentials credentialsFor(TlsConfig tls, Endpoint endpoint) {
    if (endpoint.isPlaintext()) {
      logger.warn("Using plaintext transport for {}, TLS configuration is ignored", endpoint);
      return InsecureChannelCredentials.create();
    }
    return tls.toChannelCredentials();
  }

  private ManagedChannel build(
      ManagedChannelBuilder<?> builder, TlsConfig tls, InterceptorChain interceptors) {
    tls.serverNameOverride().ifPresent(builder::overrideAuthority);
    builder
        .keepAliveTime(options.keepAliveTime().toMillis(), TimeUnit.MILLISECONDS)
        .keepAliveWithoutCalls(options.keepAliveWithoutCalls())
        .userAgent(Version.USER_AGENT);

    // Interceptors added later run first, so the deadline is in place before the chain runs
    final List<ClientInterceptor> allInterceptors = new ArrayList<>();
    allInterceptors.add(interceptors);
    options
        .defaultDeadline()
        .ifPresent(deadline -> allInterceptors.add(new DefaultDeadlineClientInterceptor(deadline)));

    return builder.intercept(allInterceptors).build();
  }

  private CompletableFuture<ManagedChannel> connect(ManagedChannel channel, Endpoint endpoint) {
    final CompletableFuture<ManagedChannel> result = new CompletableFuture<>();
    final long timeoutMillis = options.connectTimeout().toMillis();
    // Completing the timer removes its scheduled timeout task
    final CompletableFuture<Void> timer =
        new CompletableFuture<Void>().orTimeout(timeoutMillis, TimeUnit.MILLISECONDS);
    timer.whenComplete(
        (ignored, error) -> {
          if (error instanceof TimeoutException) {
            result.completeExceptionally(
                new ChannelEstablishmentException(
                    endpoint, "Channel not ready within " + timeoutMillis + " ms"));
          }
        });

    result.whenComplete(
        (ready, error) -> {
          timer.complete(null);
          if (error != null) {
            // Covers failures, timeouts and cancellation by the caller
            channel.shutdownNow();
            logger.debug("Released channel to {} after failed establishment", endpoint);
          } else {
            logger.debug("Channel to {} is ready", endpoint);
          }
        });

    awaitReady(channel, endpoint, result);
    return result;
  }

  private static void awaitReady(
      ManagedChannel channel, Endpoint endpoint, CompletableFuture<ManagedChannel> result) {
    if (result.isDone()) {
      return;
    }
    final ConnectivityState state = channel.getState(true);
    switch (state) {
      case READY:
        result.complete(channel);
        break;
      case TRANSIENT_FAILURE:
        logger.warn("Failed to connect to {}", endpoint);
        result.completeExceptionally(
            new ChannelEstablishmentException(endpoint, "Failed to connect"));
        break;
      case SHUTDOWN:
        result.completeExceptionally(
            new ChannelEstablishmentException(endpoint, "Channel was shut down while connecting"));
        break;
      default:
        channel.notifyWhenStateChanged(state, () -> awaitReady(channel, endpoint, result));
    }
  }
}
