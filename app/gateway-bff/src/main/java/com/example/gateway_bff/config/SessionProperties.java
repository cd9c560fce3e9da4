/*
 * どこで: app/gateway-bff/src/main/java/com/example/gateway_bff/config/SessionProperties.java
 * 何を: セッションと Cookie の設定値を保持する
 * なぜ: TTL/Cookie 属性を環境ごとに切替可能にし、署名鍵なしでは起動させないため
 */
package com.example.gateway_bff.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "gateway.session")
public record SessionProperties(
    @NotBlank @Size(min = 32) String cookieSecret,
    @NotBlank String cookieName,
    @NotNull Duration ttl,
    boolean secureCookie,
    @NotBlank String sameSite) {

  // local 環境は Secure=false を既定値にする
  public SessionProperties {
    cookieName = cookieName == null || cookieName.isBlank() ? "MSS_SESSION" : cookieName;
    ttl = ttl == null ? Duration.ofHours(8) : ttl;
    sameSite = sameSite == null || sameSite.isBlank() ? "Lax" : sameSite;
  }
}
