package com.spotify.confidence.grpc;

/**
 * Version information for the Confidence gRPC client library. This version is updated
 * automatically by release-please.
 */
public final class Version {
  /** Current version of the Confidence gRPC client library. */
  public static final String VERSION = "0.1.0"; // x-release-please-version

  static final String USER_AGENT = "confidence-grpc-java/" + VERSION;

  private Version() {
    // Utility class, prevent instantiation
  }
}
