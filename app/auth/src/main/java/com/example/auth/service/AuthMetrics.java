/*
 * どこで: Auth サービス層
 * 何を: ログイン結果とトークン操作の結果をメトリクスとして記録する
 * なぜ: state_mismatch や token_exchange_failed の増加を Prometheus から観測できるようにするため
 */
package com.example.auth.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class AuthMetrics {

  private static final String METRIC_LOGIN_TOTAL = "auth.login.total";
  private static final String METRIC_TOKEN_TOTAL = "auth.token.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> loginCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> tokenCounters = new ConcurrentHashMap<>();

  public AuthMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordLoginResult(String result) {
    loginCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_LOGIN_TOTAL)
                    .description("Auth callback outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordTokenResult(String operation, boolean valid) {
    final String result = valid ? "valid" : "invalid";
    final String key = operation + "|" + result;
    tokenCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_TOKEN_TOTAL)
                    .description("Session token verify/refresh outcomes")
                    .tags(Tags.of("operation", operation, "result", result))
                    .register(meterRegistry))
        .increment();
  }
}
