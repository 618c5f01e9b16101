package com.spotify.confidence.grpc;

import com.google.common.net.HostAndPort;
import com.spotify.confidence.grpc.Exceptions.InvalidConfigurationException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

/**
 * A validated gRPC target: scheme, host and port.
 *
 * <p>{@code https} endpoints are dialed over TLS. {@code http} endpoints are dialed in plaintext
 * and are meant for local mock servers.
 */
public final class Endpoint {
  public static final String HTTPS = "https";
  public static final String HTTP = "http";

  private final String scheme;
  private final HostAndPort hostAndPort;

  private Endpoint(String scheme, HostAndPort hostAndPort) {
    this.scheme = scheme;
    this.hostAndPort = hostAndPort;
  }

  /**
   * Creates an endpoint from its parts.
   *
   * @throws InvalidConfigurationException if the scheme is unknown, the host is blank or the port
   *     is out of range
   */
  public static Endpoint of(String scheme, String host, int port) {
    final String normalizedScheme = validateScheme(scheme);
    if (host == null || host.isBlank()) {
      throw new InvalidConfigurationException("Endpoint host must not be empty");
    }
    if (port < 1 || port > 65535) {
      throw new InvalidConfigurationException("Endpoint port out of range: " + port);
    }
    try {
      return new Endpoint(normalizedScheme, HostAndPort.fromParts(host.trim(), port));
    } catch (IllegalArgumentException e) {
      throw new InvalidConfigurationException("Invalid endpoint host: " + host, e);
    }
  }

  /**
   * Parses an endpoint such as {@code https://edge-grpc.spotify.com} or {@code
   * http://localhost:8080}. The port defaults to 443 for https and 80 for http.
   *
   * @throws InvalidConfigurationException if the value is not a valid endpoint URI
   */
  public static Endpoint parse(String uri) {
    if (uri == null || uri.isBlank()) {
      throw new InvalidConfigurationException("Endpoint must not be empty");
    }
    final URI parsed;
    try {
      parsed = new URI(uri.trim());
    } catch (URISyntaxException e) {
      throw new InvalidConfigurationException("Malformed endpoint: " + uri, e);
    }
    if (parsed.getScheme() == null) {
      throw new InvalidConfigurationException("Endpoint is missing a scheme: " + uri);
    }
    final String scheme = validateScheme(parsed.getScheme());
    if (parsed.getRawUserInfo() != null) {
      throw new InvalidConfigurationException("Endpoint must not contain user info");
    }
    final String path = parsed.getRawPath();
    if (path != null && !path.isEmpty() && !path.equals("/")) {
      throw new InvalidConfigurationException("Endpoint must not contain a path: " + uri);
    }
    if (parsed.getRawQuery() != null || parsed.getRawFragment() != null) {
      throw new InvalidConfigurationException(
          "Endpoint must not contain a query or fragment: " + uri);
    }
    if (parsed.getHost() == null) {
      if (parsed.getRawAuthority() != null) {
        throw new InvalidConfigurationException("Endpoint host is not a valid hostname");
      }
      throw new InvalidConfigurationException("Endpoint host must not be empty: " + uri);
    }
    final int port =
        parsed.getPort() != -1 ? parsed.getPort() : (scheme.equals(HTTPS) ? 443 : 80);
    return of(scheme, parsed.getHost(), port);
  }

  private static String validateScheme(String scheme) {
    if (scheme == null) {
      throw new InvalidConfigurationException("Endpoint scheme must not be null");
    }
    final String lower = scheme.toLowerCase(Locale.ROOT);
    if (!lower.equals(HTTPS) && !lower.equals(HTTP)) {
      throw new InvalidConfigurationException("Unsupported endpoint scheme: " + scheme);
    }
    return lower;
  }

  public String scheme() {
    return scheme;
  }

  public String host() {
    return hostAndPort.getHost();
  }

  public int port() {
    return hostAndPort.getPort();
  }

  public boolean isPlaintext() {
    return scheme.equals(HTTP);
  }

  /** The target string handed to the gRPC name resolver, e.g. {@code dns:///example.com:443}. */
  public String target() {
    return "dns:///" + hostAndPort;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Endpoint)) {
      return false;
    }
    final Endpoint other = (Endpoint) o;
    return scheme.equals(other.scheme) && hostAndPort.equals(other.hostAndPort);
  }

  @Override
  public int hashCode() {
    return Objects.hash(scheme, hostAndPort);
  }

  @Override
  public String toString() {
    return scheme + "://" + hostAndPort;
  }
}
