/*
 * どこで: Auth 設定
 * 何を: OAuth プロバイダの client 資格情報/エンドポイント上書き/タイムアウトを保持する
 * なぜ: プロバイダ追加と資格情報の投入を設定だけで完結させるため
 */
package com.example.auth.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "auth.oauth")
public record OAuthProperties(
    Duration connectTimeout,
    Duration readTimeout,
    Boolean linkByEmail,
    List<String> requiredProviders,
    Map<String, Provider> providers) {

  public OAuthProperties {
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(10) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
    linkByEmail = linkByEmail == null ? Boolean.TRUE : linkByEmail;
    requiredProviders = requiredProviders == null ? List.of() : List.copyOf(requiredProviders);
    providers = providers == null ? Map.of() : Map.copyOf(providers);
  }

  public record Provider(
      String clientId,
      String clientSecret,
      String redirectUri,
      String authorizeUrl,
      String tokenUrl,
      String profileUrl,
      String scope) {

    @Override
    public String toString() {
      return "Provider[clientId=" + clientId + ", redirectUri=" + redirectUri + "]";
    }
  }
}
