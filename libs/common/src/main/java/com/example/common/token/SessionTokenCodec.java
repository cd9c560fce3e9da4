package com.example.common.token;

import com.example.common.security.Identity;
import com.nimbusds.jose.jwk.source.ImmutableSecret;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.JwtTimestampValidator;
import org.springframework.security.oauth2.jwt.JwtValidationException;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

/**
 * HS256 で署名したセッショントークンの発行・検証・延長を行う。
 *
 * <p>トークンはサーバー側に状態を持たない。有効性は署名と exp だけで決まり、検証失敗の理由
 * (改ざん・期限切れ・形式不正)は呼び出し側に区別させない。理由はログにのみ出す。
 *
 * <p>鍵と Clock 以外の状態を持たないため、同期なしで並行利用できる。
 */
public class SessionTokenCodec {

  private static final Logger logger = LoggerFactory.getLogger(SessionTokenCodec.class);

  static final String CLAIM_EMAIL = "email";
  static final String CLAIM_NAME = "name";
  static final String CLAIM_ROLE = "role";
  static final String CLAIM_PICTURE = "picture";

  private final JwtEncoder encoder;
  private final JwtDecoder decoder;
  private final Duration ttl;
  private final Clock clock;

  public SessionTokenCodec(@NonNull SessionTokenProperties properties, @NonNull Clock clock) {
    final SecretKey key =
        new SecretKeySpec(properties.secret().getBytes(StandardCharsets.UTF_8), "HmacSHA256");
    this.encoder = new NimbusJwtEncoder(new ImmutableSecret<>(key));
    final NimbusJwtDecoder nimbusDecoder =
        NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
    // 既定の 60 秒 skew は使わない。exp 判定は toClaims で now < exp として行う
    final JwtTimestampValidator timestampValidator = new JwtTimestampValidator(Duration.ZERO);
    timestampValidator.setClock(clock);
    nimbusDecoder.setJwtValidator(timestampValidator);
    this.decoder = nimbusDecoder;
    this.ttl = properties.ttl();
    this.clock = clock;
  }

  /** identity を claims とした署名済みトークンを発行する。exp は iat + ttl。 */
  public String issue(@NonNull Identity identity) {
    return encode(identity, now());
  }

  /** 署名と期限を確認し、検証済み claims を返す。失敗は理由を問わず empty。 */
  public Optional<SessionClaims> verify(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    final Jwt jwt;
    try {
      jwt = decoder.decode(token);
    } catch (JwtValidationException ex) {
      logger.debug("session token rejected by validator: {}", ex.getErrors());
      return Optional.empty();
    } catch (BadJwtException ex) {
      logger.debug("session token malformed or signature mismatch: {}", ex.getMessage());
      return Optional.empty();
    } catch (JwtException ex) {
      logger.warn("session token could not be processed", ex);
      return Optional.empty();
    }
    return toClaims(jwt);
  }

  /**
   * 現在有効なトークンを同じ identity で再発行し、有効期間を延長する。
   *
   * <p>IdP への再認証は行わない。検証に失敗したトークンは延長しない。
   */
  public Optional<String> refresh(String token) {
    return verify(token)
        .map(claims -> encode(claims.identity(), nextIssuedAt(claims.issuedAt())));
  }

  private String encode(Identity identity, Instant issuedAt) {
    final JwtClaimsSet.Builder claims =
        JwtClaimsSet.builder()
            .subject(identity.subjectId())
            .issuedAt(issuedAt)
            .expiresAt(issuedAt.plus(ttl))
            .claim(CLAIM_EMAIL, identity.email())
            .claim(CLAIM_ROLE, identity.role());
    if (identity.displayName() != null) {
      claims.claim(CLAIM_NAME, identity.displayName());
    }
    if (identity.avatarUrl() != null) {
      claims.claim(CLAIM_PICTURE, identity.avatarUrl());
    }
    final JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
    return encoder.encode(JwtEncoderParameters.from(header, claims.build())).getTokenValue();
  }

  private Optional<SessionClaims> toClaims(Jwt jwt) {
    final Instant issuedAt = jwt.getIssuedAt();
    final Instant expiresAt = jwt.getExpiresAt();
    final String subject = jwt.getSubject();
    final String email = jwt.getClaimAsString(CLAIM_EMAIL);
    final String role = jwt.getClaimAsString(CLAIM_ROLE);
    if (issuedAt == null || expiresAt == null || isBlank(subject) || isBlank(email)
        || isBlank(role)) {
      logger.debug("session token is missing required claims");
      return Optional.empty();
    }
    if (!now().isBefore(expiresAt)) {
      logger.debug("session token expired at {}", expiresAt);
      return Optional.empty();
    }
    final Identity identity =
        new Identity(
            subject,
            email,
            jwt.getClaimAsString(CLAIM_NAME),
            jwt.getClaimAsString(CLAIM_PICTURE),
            role);
    return Optional.of(new SessionClaims(identity, issuedAt, expiresAt));
  }

  // JWT の NumericDate は秒精度のため、同一秒内の延長では iat を 1 秒進める
  private Instant nextIssuedAt(Instant previousIssuedAt) {
    final Instant now = now();
    return now.isAfter(previousIssuedAt) ? now : previousIssuedAt.plusSeconds(1);
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.SECONDS);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
