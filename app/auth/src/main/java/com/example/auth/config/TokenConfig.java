/*
 * どこで: Auth 設定
 * 何を: トークン失効ストアとパスワードハッシャの Bean を組み立てる
 * なぜ: 実装差し替え (共有ストア/別アルゴリズム) を設定クラスだけで完結させるため
 */
package com.example.auth.config;

import com.example.auth.service.BCryptCredentialHasher;
import com.example.auth.service.CredentialHasher;
import com.example.auth.service.InMemoryRevocationStore;
import com.example.auth.service.RevocationStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TokenProperties.class)
public class TokenConfig {

  @Bean
  RevocationStore revocationStore() {
    // 単一インスタンス前提。複数台構成では共有ストア実装へ置き換える。
    return new InMemoryRevocationStore();
  }

  @Bean
  CredentialHasher credentialHasher(
      @Value("${auth.credential.bcrypt-strength:12}") int bcryptStrength) {
    return new BCryptCredentialHasher(bcryptStrength);
  }
}
