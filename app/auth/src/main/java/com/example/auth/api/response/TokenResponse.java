/*
 * どこで: Auth API レスポンス DTO
 * 何を: 発行したアクセストークンと有効期限 (秒) を返す
 * なぜ: OAuth のトークン応答と同じ形にしてクライアント実装を共通化するため
 */
package com.example.auth.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Duration;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TokenResponse(String accessToken, String tokenType, long expiresIn) {

  public static TokenResponse bearer(String accessToken, Duration ttl) {
    return new TokenResponse(accessToken, "bearer", ttl.toSeconds());
  }
}
