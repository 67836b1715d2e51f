/*
 * どこで: Common 共通設定
 * 何を: 認証サービス全体で共有する UTC の Clock を提供する
 * なぜ: トークン期限や updated_at をテストから固定時刻で検証できるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
