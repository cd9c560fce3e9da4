package com.example.auth.config;

import java.time.Clock;
import java.util.List;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimNames;
import org.springframework.security.oauth2.jwt.JwtTimestampValidator;

/** IdP が発行した id_token の exp/iss/aud を検証する validator を組み立てる。 */
public final class IdTokenValidators {

  private static final String INVALID_TOKEN = "invalid_token";

  private IdTokenValidators() {}

  public static OAuth2TokenValidator<Jwt> create(OidcProviderProperties properties, Clock clock) {
    final JwtTimestampValidator timestamps = new JwtTimestampValidator(properties.clockSkew());
    timestamps.setClock(clock);
    return new DelegatingOAuth2TokenValidator<>(
        List.of(
            timestamps,
            requireExpiry(),
            issuerIn(properties.issuers()),
            audienceContains(properties.clientId())));
  }

  private static OAuth2TokenValidator<Jwt> requireExpiry() {
    return jwt ->
        jwt.getExpiresAt() != null
            ? OAuth2TokenValidatorResult.success()
            : failure("exp claim is required");
  }

  // Google は scheme なしの issuer も発行するため、URL 変換せず文字列で比較する
  private static OAuth2TokenValidator<Jwt> issuerIn(List<String> issuers) {
    return jwt -> {
      final String issuer = jwt.getClaimAsString(JwtClaimNames.ISS);
      return issuer != null && issuers.contains(issuer)
          ? OAuth2TokenValidatorResult.success()
          : failure("unexpected issuer");
    };
  }

  private static OAuth2TokenValidator<Jwt> audienceContains(String clientId) {
    return jwt -> {
      final List<String> audience = jwt.getAudience();
      return audience != null && audience.contains(clientId)
          ? OAuth2TokenValidatorResult.success()
          : failure("audience does not contain client id");
    };
  }

  private static OAuth2TokenValidatorResult failure(String description) {
    return OAuth2TokenValidatorResult.failure(new OAuth2Error(INVALID_TOKEN, description, null));
  }
}
