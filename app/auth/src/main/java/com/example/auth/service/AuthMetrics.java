/*
 * どこで: Auth サービス層
 * 何を: ログイン結果と認証エラーコードのメトリクスを記録する
 * なぜ: ログイン成功率やプロバイダ障害の増加を Prometheus から観測できるようにするため
 */
package com.example.auth.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class AuthMetrics {

  private static final String METRIC_LOGIN_TOTAL = "auth.login.total";
  private static final String METRIC_ERROR_TOTAL = "auth.error.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> loginCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> errorCounters = new ConcurrentHashMap<>();

  public AuthMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordLoginResult(String method, String result) {
    final String key = method + "|" + result;
    loginCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_LOGIN_TOTAL)
                    .description("Token issuance outcomes by login method")
                    .tags(Tags.of("method", method, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordAuthError(String code) {
    errorCounters
        .computeIfAbsent(
            code,
            ignored ->
                Counter.builder(METRIC_ERROR_TOTAL)
                    .description("Authentication failures by error code")
                    .tags(Tags.of("code", code))
                    .register(meterRegistry))
        .increment();
  }
}
