/*
 * どこで: Common セッショントークン設定
 * 何を: 署名鍵とトークン有効期間を保持する
 * なぜ: 鍵未設定のまま起動しないよう、バインド時に検証するため
 */
package com.example.common.token;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "session-token")
public record SessionTokenProperties(
    // HS256 は 256bit 以上の鍵を要求する
    @NotBlank @Size(min = 32) String secret, @NotNull Duration ttl) {

  public SessionTokenProperties {
    ttl = ttl == null ? Duration.ofHours(8) : ttl;
  }
}
