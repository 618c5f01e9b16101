package com.spotify.confidence.grpc;

import java.util.concurrent.CancellationException;

/**
 * Failures raised while preparing a channel or decorating outgoing calls.
 *
 * <p>Configuration and credential errors are programming or deployment mistakes and are unchecked.
 * Establishment and interceptor errors are expected at runtime and are checked.
 */
public final class Exceptions {

  private Exceptions() {}

  /** A TLS configuration, endpoint or header name is malformed. Detected before any I/O. */
  public static class InvalidConfigurationException extends IllegalArgumentException {
    public InvalidConfigurationException(String message) {
      super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** A credential was structurally invalid when an interceptor was constructed. */
  public static class InvalidCredentialException extends IllegalArgumentException {
    public InvalidCredentialException(String message) {
      super(message);
    }
  }

  /**
   * The transport could not be built or the initial connection failed. The caller decides whether
   * to retry.
   */
  public static class ChannelEstablishmentException extends Exception {
    private final Endpoint endpoint;

    public ChannelEstablishmentException(Endpoint endpoint, String message) {
      super(message + " [endpoint=" + endpoint + "]");
      this.endpoint = endpoint;
    }

    public ChannelEstablishmentException(Endpoint endpoint, String message, Throwable cause) {
      super(message + " [endpoint=" + endpoint + "]", cause);
      this.endpoint = endpoint;
    }

    public Endpoint endpoint() {
      return endpoint;
    }
  }

  /** A credential could not be resolved or applied to a single outgoing call. */
  public static class InterceptorException extends Exception {
    private final String interceptor;
    private final String credential;

    public InterceptorException(String interceptor, String credential, String message) {
      super(interceptor + " could not apply " + credential + ": " + message);
      this.interceptor = interceptor;
      this.credential = credential;
    }

    public InterceptorException(
        String interceptor, String credential, String message, Throwable cause) {
      super(interceptor + " could not apply " + credential + ": " + message, cause);
      this.interceptor = interceptor;
      this.credential = credential;
    }

    /** Name of the interceptor that failed. */
    public String interceptor() {
      return interceptor;
    }

    /** Name of the credential (never its value) that was missing or unresolvable. */
    public String credential() {
      return credential;
    }

    /** True when credential resolution was interrupted or cancelled rather than failing. */
    public boolean isCancelled() {
      final Throwable cause = getCause();
      return cause instanceof InterruptedException || cause instanceof CancellationException;
    }
  }
}
