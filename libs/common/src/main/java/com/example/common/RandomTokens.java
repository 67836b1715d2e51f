package com.example.common;

import java.security.SecureRandom;
import java.util.Base64;

/** URL-safe random values for CSRF state and token ids. */
public final class RandomTokens {
  private static final SecureRandom RANDOM = new SecureRandom();
  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

  private RandomTokens() {}

  public static String urlSafe(int byteLength) {
    if (byteLength <= 0) {
      throw new IllegalArgumentException("byteLength must be positive");
    }
    final byte[] bytes = new byte[byteLength];
    RANDOM.nextBytes(bytes);
    return ENCODER.encodeToString(bytes);
  }
}
