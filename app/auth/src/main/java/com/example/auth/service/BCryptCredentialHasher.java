package com.example.auth.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

public class BCryptCredentialHasher implements CredentialHasher {

  private static final Logger logger = LoggerFactory.getLogger(BCryptCredentialHasher.class);

  private final BCryptPasswordEncoder encoder;

  public BCryptCredentialHasher(int strength) {
    this.encoder = new BCryptPasswordEncoder(strength);
  }

  @Override
  public String hash(String secret) {
    if (secret == null || secret.isEmpty()) {
      throw new IllegalArgumentException("secret is required");
    }
    return encoder.encode(secret);
  }

  @Override
  public boolean verify(String secret, String digest) {
    if (secret == null || digest == null || digest.isBlank()) {
      return false;
    }
    // BCryptPasswordEncoder は形式不正の digest を WARN ログ付きで false とする
    final boolean matches = encoder.matches(secret, digest);
    if (!matches) {
      logger.debug("credential digest did not match");
    }
    return matches;
  }
}
