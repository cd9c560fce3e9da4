/*
 * どこで: Auth 設定バインド
 * 何を: IdP のクライアント資格情報とエンドポイントを保持する
 * なぜ: 資格情報が欠けた状態では起動させないため
 */
package com.example.auth.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "oidc")
public record OidcProviderProperties(
    @NotBlank String clientId,
    @NotBlank String clientSecret,
    @NotBlank String redirectUri,
    @NotBlank String authorizationUri,
    @NotBlank String tokenUri,
    @NotBlank String jwkSetUri,
    @NotEmpty List<String> issuers,
    @NotBlank String scope,
    @NotNull Duration clockSkew,
    @NotNull Duration connectTimeout,
    @NotNull Duration readTimeout) {

  // 資格情報以外は Google の公開値を既定にする
  public OidcProviderProperties {
    authorizationUri =
        isBlank(authorizationUri)
            ? "https://accounts.google.com/o/oauth2/auth"
            : authorizationUri;
    tokenUri = isBlank(tokenUri) ? "https://oauth2.googleapis.com/token" : tokenUri;
    jwkSetUri = isBlank(jwkSetUri) ? "https://www.googleapis.com/oauth2/v3/certs" : jwkSetUri;
    issuers =
        issuers == null || issuers.isEmpty()
            ? List.of("accounts.google.com", "https://accounts.google.com")
            : List.copyOf(issuers);
    scope = isBlank(scope) ? "openid email profile" : scope;
    clockSkew = clockSkew == null ? Duration.ofSeconds(60) : clockSkew;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(3) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
