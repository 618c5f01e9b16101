package com.spotify.confidence.grpc.interceptor;

import com.spotify.confidence.grpc.Exceptions.InterceptorException;
import com.spotify.confidence.grpc.Exceptions.InvalidCredentialException;
import io.grpc.Metadata;
import java.util.Objects;

/**
 * Attaches {@code authorization: Bearer <token>} to every outgoing call.
 *
 * <p>The token is either fixed at construction or resolved from a {@link TokenProvider} on every
 * call, which allows refreshable tokens. Provider failures abort the affected call only.
 */
public class BearerTokenInterceptor implements Interceptor {
  public static final Metadata.Key<String> AUTHORIZATION =
      Metadata.Key.of("authorization", Metadata.ASCII_STRING_MARSHALLER);

  private static final String BEARER_PREFIX = "Bearer ";
  private static final String CREDENTIAL = "bearer token";

  private final TokenProvider tokenProvider;
  private final boolean dynamic;

  /**
   * Sends a fixed token.
   *
   * @throws InvalidCredentialException if the token is empty or not printable ASCII
   */
  public BearerTokenInterceptor(String token) {
    if (token == null || token.isEmpty()) {
      throw new InvalidCredentialException("Bearer token must not be empty");
    }
    if (!Credentials.isPrintableAscii(token)) {
      throw new InvalidCredentialException("Bearer token must be printable ASCII");
    }
    this.tokenProvider = () -> token;
    this.dynamic = false;
  }

  /** Resolves the token from {@code tokenProvider} on every call. */
  public BearerTokenInterceptor(TokenProvider tokenProvider) {
    this.tokenProvider = Objects.requireNonNull(tokenProvider, "tokenProvider");
    this.dynamic = true;
  }

  @Override
  public void intercept(Metadata headers) throws InterceptorException {
    Credentials.overwrite(headers, AUTHORIZATION, BEARER_PREFIX + resolveToken());
  }

  private String resolveToken() throws InterceptorException {
    final String token;
    try {
      token = tokenProvider.token();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw failure("token resolution was interrupted", e);
    } catch (Exception e) {
      throw failure("token provider failed", e);
    }
    if (token == null || token.isEmpty()) {
      throw new InterceptorException(name(), CREDENTIAL, "token provider returned no token");
    }
    if (!Credentials.isPrintableAscii(token)) {
      throw new InterceptorException(name(), CREDENTIAL, "token is not printable ASCII");
    }
    return token;
  }

  private InterceptorException failure(String message, Exception cause) {
    return new InterceptorException(name(), CREDENTIAL, message, cause);
  }

  private String name() {
    return getClass().getSimpleName();
  }

  @Override
  public String toString() {
    return "BearerTokenInterceptor{token=" + (dynamic ? "dynamic" : Credentials.MASK) + "}";
  }
}
