/*
 * どこで: Gateway-BFF 設定
 * 何を: auth-service 呼び出し設定を保持する
 * なぜ: BFF からの下流 URL/パス/タイムアウトを外部化するため
 */
package com.example.gateway_bff.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "auth-service")
public record AuthServiceClientProperties(
    String baseUrl,
    String loginPath,
    String verifyPath,
    String refreshPath,
    Duration connectTimeout,
    Duration readTimeout) {

  public AuthServiceClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://localhost:5001" : baseUrl;
    loginPath = loginPath == null || loginPath.isBlank() ? "/auth/login" : loginPath;
    verifyPath = verifyPath == null || verifyPath.isBlank() ? "/auth/verify" : verifyPath;
    refreshPath = refreshPath == null || refreshPath.isBlank() ? "/auth/refresh" : refreshPath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
  }
}
