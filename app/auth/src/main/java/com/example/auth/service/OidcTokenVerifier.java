package com.example.auth.service;

import com.example.auth.model.OidcClaims;
import com.example.auth.model.RejectReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.JwtValidationException;
import org.springframework.stereotype.Service;

@Service
public class OidcTokenVerifier {

  private static final Logger logger = LoggerFactory.getLogger(OidcTokenVerifier.class);

  private final JwtDecoder idTokenDecoder;

  public OidcTokenVerifier(JwtDecoder idTokenDecoder) {
    this.idTokenDecoder = idTokenDecoder;
  }

  /**
   * id_token の署名(IdP の JWK)、exp、iss、aud を検証し claims を取り出す。
   *
   * <p>検証失敗・sub/email 欠落は INVALID_IDENTITY。JWK Set を取得できない場合は EXCHANGE_FAILED。
   */
  public OidcClaims verify(String idToken) {
    if (idToken == null || idToken.isBlank()) {
      throw invalid("id_token is required", null);
    }
    final Jwt jwt;
    try {
      jwt = idTokenDecoder.decode(idToken);
    } catch (JwtValidationException ex) {
      logger.warn("id_token claims rejected: {}", ex.getErrors());
      throw invalid("id_token claims rejected", ex);
    } catch (BadJwtException ex) {
      logger.warn("id_token verification failed: {}", ex.getMessage());
      throw invalid("id_token verification failed", ex);
    } catch (JwtException ex) {
      // JWK Set の取得失敗など、トークン自体ではなく IdP 側の問題
      logger.warn("id_token could not be verified against provider keys: {}", ex.getMessage());
      throw new LoginRejectedException(
          RejectReason.EXCHANGE_FAILED, "provider keys are unavailable", ex);
    }

    final String subject = jwt.getSubject();
    final String email = jwt.getClaimAsString("email");
    if (isBlank(subject) || isBlank(email)) {
      logger.warn("id_token is missing sub or email");
      throw invalid("id_token is missing sub or email", null);
    }
    return new OidcClaims(
        subject, email, jwt.getClaimAsString("name"), jwt.getClaimAsString("picture"));
  }

  private LoginRejectedException invalid(String message, Throwable cause) {
    return new LoginRejectedException(RejectReason.INVALID_IDENTITY, message, cause);
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
