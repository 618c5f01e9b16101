package com.spotify.confidence.grpc.interceptor;

import io.grpc.Metadata;

final class Credentials {
  static final String MASK = "****";

  private Credentials() {}

  // Printable ASCII is what an ASCII metadata value may carry on the wire.
  static boolean isPrintableAscii(String value) {
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        return false;
      }
    }
    return true;
  }

  /** Replaces every value of {@code key} with {@code value}. */
  static void overwrite(Metadata headers, Metadata.Key<String> key, String value) {
    headers.removeAll(key);
    headers.put(key, value);
  }
}
