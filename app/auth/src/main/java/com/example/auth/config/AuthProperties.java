/*
 * どこで: Auth 設定バインド
 * 何を: フロントエンド URL、state 有効期間、メールアドレス別ロール表を保持する
 */
package com.example.auth.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "auth")
public record AuthProperties(
    @NotBlank String frontendUrl,
    @NotNull Duration stateTtl,
    Map<String, String> roles,
    boolean diagnosticsEnabled) {

  public AuthProperties {
    frontendUrl =
        frontendUrl == null || frontendUrl.isBlank() ? "http://localhost:3000" : frontendUrl;
    stateTtl = stateTtl == null ? Duration.ofMinutes(10) : stateTtl;
    // メールアドレスは大文字小文字を区別せずに引く
    roles =
        roles == null
            ? Map.of()
            : roles.entrySet().stream()
                .collect(
                    Collectors.toUnmodifiableMap(
                        entry -> entry.getKey().trim().toLowerCase(Locale.ROOT),
                        entry -> entry.getValue().trim(),
                        (first, second) -> second));
  }
}
