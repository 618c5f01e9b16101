package com.spotify.confidence.grpc;

import com.google.common.annotations.VisibleForTesting;
import com.spotify.confidence.grpc.Exceptions.InvalidConfigurationException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Tuning applied by {@link DefaultChannelFactory} to every channel it builds.
 *
 * <p>Defaults: 10 second connect timeout, keep-alive pings every 60 seconds (also while idle), a
 * one minute deadline for calls that do not set their own, and eager connection.
 */
public final class ChannelOptions {
  static final String CONNECT_TIMEOUT_ENV = "CONFIDENCE_GRPC_CONNECT_TIMEOUT_SECONDS";
  static final String KEEPALIVE_ENV = "CONFIDENCE_GRPC_KEEPALIVE_SECONDS";
  static final String DEADLINE_ENV = "CONFIDENCE_GRPC_DEADLINE_SECONDS";
  static final String CONNECT_LAZILY_ENV = "CONFIDENCE_GRPC_CONNECT_LAZILY";

  private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
  private static final Duration DEFAULT_KEEPALIVE = Duration.ofSeconds(60);
  private static final Duration DEFAULT_DEADLINE = Duration.ofMinutes(1);

  private final Duration connectTimeout;
  private final Duration keepAliveTime;
  private final boolean keepAliveWithoutCalls;
  private final Duration defaultDeadline;
  private final boolean connectLazily;

  private ChannelOptions(
      Duration connectTimeout,
      Duration keepAliveTime,
      boolean keepAliveWithoutCalls,
      Duration defaultDeadline,
      boolean connectLazily) {
    this.connectTimeout = requirePositive(connectTimeout, "connect timeout");
    this.keepAliveTime = requirePositive(keepAliveTime, "keep-alive time");
    this.keepAliveWithoutCalls = keepAliveWithoutCalls;
    this.defaultDeadline =
        defaultDeadline != null ? requirePositive(defaultDeadline, "default deadline") : null;
    this.connectLazily = connectLazily;
  }

  public static ChannelOptions defaults() {
    return new ChannelOptions(
        DEFAULT_CONNECT_TIMEOUT, DEFAULT_KEEPALIVE, true, DEFAULT_DEADLINE, false);
  }

  /** Defaults overridden by the {@code CONFIDENCE_GRPC_*} environment variables that are set. */
  public static ChannelOptions fromEnvironment() {
    return fromLookup(System::getenv);
  }

  @VisibleForTesting
  static ChannelOptions fromEnvironment(Map<String, String> env) {
    return fromLookup(env::get);
  }

  private static ChannelOptions fromLookup(Function<String, String> env) {
    final ChannelOptions defaults = defaults();
    return new ChannelOptions(
        seconds(env, CONNECT_TIMEOUT_ENV).orElse(defaults.connectTimeout),
        seconds(env, KEEPALIVE_ENV).orElse(defaults.keepAliveTime),
        defaults.keepAliveWithoutCalls,
        seconds(env, DEADLINE_ENV).orElse(defaults.defaultDeadline),
        Optional.ofNullable(env.apply(CONNECT_LAZILY_ENV))
            .map(Boolean::parseBoolean)
            .orElse(defaults.connectLazily));
  }

  private static Optional<Duration> seconds(Function<String, String> env, String name) {
    final String value = env.apply(name);
    if (value == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(Duration.ofSeconds(Long.parseLong(value.trim())));
    } catch (NumberFormatException e) {
      throw new InvalidConfigurationException(name + " is not a number of seconds: " + value, e);
    }
  }

  private static Duration requirePositive(Duration duration, String what) {
    if (duration == null || duration.isZero() || duration.isNegative()) {
      throw new InvalidConfigurationException(what + " must be positive, was " + duration);
    }
    return duration;
  }

  public ChannelOptions withConnectTimeout(Duration connectTimeout) {
    return new ChannelOptions(
        connectTimeout, keepAliveTime, keepAliveWithoutCalls, defaultDeadline, connectLazily);
  }

  public ChannelOptions withKeepAlive(Duration keepAliveTime, boolean keepAliveWithoutCalls) {
    return new ChannelOptions(
        connectTimeout, keepAliveTime, keepAliveWithoutCalls, defaultDeadline, connectLazily);
  }

  /** Deadline for calls that carry none. {@code null} leaves such calls without a deadline. */
  public ChannelOptions withDefaultDeadline(Duration defaultDeadline) {
    return new ChannelOptions(
        connectTimeout, keepAliveTime, keepAliveWithoutCalls, defaultDeadline, connectLazily);
  }

  /** When lazy, channels are returned idle and connect on their first call. */
  public ChannelOptions withConnectLazily(boolean connectLazily) {
    return new ChannelOptions(
        connectTimeout, keepAliveTime, keepAliveWithoutCalls, defaultDeadline, connectLazily);
  }

  public Duration connectTimeout() {
    return connectTimeout;
  }

  public Duration keepAliveTime() {
    return keepAliveTime;
  }

  public boolean keepAliveWithoutCalls() {
    return keepAliveWithoutCalls;
  }

  public Optional<Duration> defaultDeadline() {
    return Optional.ofNullable(defaultDeadline);
  }

  public boolean connectLazily() {
    return connectLazily;
  }

  @Override
  public String toString() {
    return "ChannelOptions{connectTimeout="
        + connectTimeout
        + ", keepAliveTime="
        + keepAliveTime
        + ", keepAliveWithoutCalls="
        + keepAliveWithoutCalls
        + ", defaultDeadline="
        + defaultDeadline
        + ", connectLazily="
        + connectLazily
        + "}";
  }
}
