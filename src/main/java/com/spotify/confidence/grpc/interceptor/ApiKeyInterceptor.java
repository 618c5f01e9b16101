package com.spotify.confidence.grpc.interceptor;

import com.spotify.confidence.grpc.Exceptions.InvalidConfigurationException;
import com.spotify.confidence.grpc.Exceptions.InvalidCredentialException;
import io.grpc.Metadata;

/** Attaches a static API key to every outgoing call. */
public class ApiKeyInterceptor implements Interceptor {
  public static final String X_API_KEY = "x-api-key";

  private final Metadata.Key<String> headerKey;
  private final String apiKey;

  /** Sends {@code apiKey} in the {@value #X_API_KEY} header. */
  public ApiKeyInterceptor(String apiKey) {
    this(X_API_KEY, apiKey);
  }

  /**
   * Sends {@code apiKey} in a custom header.
   *
   * @throws InvalidCredentialException if the key is empty or not printable ASCII
   * @throws InvalidConfigurationException if the header name is not a valid ASCII metadata key
   */
  public ApiKeyInterceptor(String headerName, String apiKey) {
    this.headerKey = asciiKey(headerName);
    this.apiKey = requireApiKey(apiKey);
  }

  public Metadata.Key<String> headerKey() {
    return headerKey;
  }

  @Override
  public void intercept(Metadata headers) {
    Credentials.overwrite(headers, headerKey, apiKey);
  }

  private static Metadata.Key<String> asciiKey(String headerName) {
    if (headerName == null || headerName.isEmpty()) {
      throw new InvalidConfigurationException("API key header name must not be empty");
    }
    if (headerName.endsWith(Metadata.BINARY_HEADER_SUFFIX)) {
      throw new InvalidConfigurationException("API key header must not be binary: " + headerName);
    }
    try {
      return Metadata.Key.of(headerName, Metadata.ASCII_STRING_MARSHALLER);
    } catch (IllegalArgumentException e) {
      throw new InvalidConfigurationException("Invalid metadata key: " + headerName, e);
    }
  }

  private static String requireApiKey(String apiKey) {
    if (apiKey == null || apiKey.isEmpty()) {
      throw new InvalidCredentialException("API key must not be empty");
    }
    if (!Credentials.isPrintableAscii(apiKey)) {
      throw new InvalidCredentialException("API key must be printable ASCII");
    }
    return apiKey;
  }

  @Override
  public String toString() {
    return "ApiKeyInterceptor{header=" + headerKey.name() + ", apiKey=" + Credentials.MASK + "}";
  }
}
