package com.example.auth.service;

import java.util.Locale;

final class EmailAddresses {
  private EmailAddresses() {}

  /** Trimmed, lower-cased email, or {@code null} when nothing usable is left. */
  static String normalize(String email) {
    if (email == null) {
      return null;
    }
    final String trimmed = email.trim();
    return trimmed.isEmpty() ? null : trimmed.toLowerCase(Locale.ROOT);
  }
}
