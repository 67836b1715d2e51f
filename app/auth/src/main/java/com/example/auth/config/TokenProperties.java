/*
 * どこで: Auth 設定
 * 何を: bearer token の署名鍵/有効期限/失効リスト掃除間隔を保持する
 * なぜ: 鍵と TTL を環境ごとに外部化するため
 */
package com.example.auth.config;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "auth.token")
public record TokenProperties(
    String signingKey, Duration ttl, Duration revocationPurgeInterval) {

  public static final int MIN_SIGNING_KEY_BYTES = 32;

  public TokenProperties {
    if (signingKey == null
        || signingKey.getBytes(StandardCharsets.UTF_8).length < MIN_SIGNING_KEY_BYTES) {
      throw new IllegalArgumentException(
          "auth.token.signing-key must be at least " + MIN_SIGNING_KEY_BYTES + " bytes");
    }
    ttl = ttl == null ? Duration.ofSeconds(3600) : ttl;
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("auth.token.ttl must be positive");
    }
    revocationPurgeInterval =
        revocationPurgeInterval == null ? Duration.ofMinutes(5) : revocationPurgeInterval;
  }

  @Override
  public String toString() {
    return "TokenProperties[signingKey=***, ttl="
        + ttl
        + ", revocationPurgeInterval="
        + revocationPurgeInterval
        + "]";
  }
}
