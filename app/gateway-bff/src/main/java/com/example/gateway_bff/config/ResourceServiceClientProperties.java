/*
 * どこで: Gateway-BFF 設定
 * 何を: resource-service 呼び出し設定を保持する
 * なぜ: 中継先の URL とタイムアウトを環境ごとに切り替えるため
 */
package com.example.gateway_bff.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "resource-service")
public record ResourceServiceClientProperties(
    String baseUrl, Duration connectTimeout, Duration readTimeout) {

  public ResourceServiceClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://localhost:5002" : baseUrl;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
  }
}
