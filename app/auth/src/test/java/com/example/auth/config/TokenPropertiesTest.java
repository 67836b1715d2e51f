/*
 * どこで: auth の token 設定テスト
 * 何を: 署名鍵の既定値が local プロファイルにしか無いことを検証する
 * なぜ: 鍵未設定の本番起動がリポジトリ内の既知の鍵で署名してしまう回帰を防ぐため
 */
package com.example.auth.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.config.YamlPropertiesFactoryBean;
import org.springframework.core.io.ClassPathResource;

class TokenPropertiesTest {

  @Test
  void blankSigningKeyFailsStartup() {
    assertThatThrownBy(() -> new TokenProperties("", null, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("auth.token.signing-key");
  }

  @Test
  void defaultConfigurationHasNoSigningKeyFallback() {
    final Properties properties = load("application.yml");

    assertThat(properties.getProperty("auth.token.signing-key"))
        .isEqualTo("${AUTH_TOKEN_SIGNING_KEY:}");
  }

  @Test
  void localProfileSuppliesDevelopmentKey() {
    final Properties properties = load("application-local.yml");

    assertThat(properties.getProperty("auth.token.signing-key"))
        .startsWith("${AUTH_TOKEN_SIGNING_KEY:")
        .isNotEqualTo("${AUTH_TOKEN_SIGNING_KEY:}");
  }

  private Properties load(String resource) {
    final YamlPropertiesFactoryBean factory = new YamlPropertiesFactoryBean();
    factory.setResources(new ClassPathResource(resource));
    return factory.getObject();
  }
}
