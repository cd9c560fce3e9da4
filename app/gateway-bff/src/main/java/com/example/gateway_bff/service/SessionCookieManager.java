package com.example.gateway_bff.service;

import com.example.gateway_bff.config.SessionProperties;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.Base64;
import java.util.Optional;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/**
 * セッション Cookie の発行・読取・削除を行う。
 *
 * <p>値は {@code sessionId.signature}。signature は cookie secret による HMAC-SHA256 で、照合は定数時間で行う。
 */
@Component
public class SessionCookieManager {

  private static final Logger logger = LoggerFactory.getLogger(SessionCookieManager.class);
  private static final String HMAC_ALGORITHM = "HmacSHA256";

  private final SessionProperties properties;
  private final SecretKeySpec signingKey;

  public SessionCookieManager(SessionProperties properties) {
    this.properties = properties;
    this.signingKey =
        new SecretKeySpec(properties.cookieSecret().getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
  }

  public String sign(String sessionId) {
    return sessionId + "." + signature(sessionId);
  }

  /** 署名が一致した場合のみセッション ID を返す。 */
  public Optional<String> verify(String cookieValue) {
    if (cookieValue == null || cookieValue.isBlank()) {
      return Optional.empty();
    }
    final int separator = cookieValue.lastIndexOf('.');
    if (separator <= 0 || separator == cookieValue.length() - 1) {
      logger.debug("session cookie has no signature");
      return Optional.empty();
    }
    final String sessionId = cookieValue.substring(0, separator);
    final byte[] expected = signature(sessionId).getBytes(StandardCharsets.US_ASCII);
    final byte[] actual = cookieValue.substring(separator + 1).getBytes(StandardCharsets.US_ASCII);
    if (!MessageDigest.isEqual(expected, actual)) {
      logger.debug("session cookie signature mismatch");
      return Optional.empty();
    }
    return Optional.of(sessionId);
  }

  public Optional<String> readCookieValue(HttpServletRequest request) {
    final Cookie[] cookies = request.getCookies();
    if (cookies == null) {
      return Optional.empty();
    }
    for (Cookie cookie : cookies) {
      if (properties.cookieName().equals(cookie.getName())) {
        return Optional.ofNullable(cookie.getValue());
      }
    }
    return Optional.empty();
  }

  public Optional<String> resolveSessionId(HttpServletRequest request) {
    return readCookieValue(request).flatMap(this::verify);
  }

  public void writeSessionCookie(HttpServletResponse response, String sessionId) {
    response.addHeader(HttpHeaders.SET_COOKIE, build(sign(sessionId), properties.ttl()).toString());
  }

  public void clearSessionCookie(HttpServletResponse response) {
    response.addHeader(HttpHeaders.SET_COOKIE, build("", Duration.ZERO).toString());
  }

  private ResponseCookie build(String value, Duration maxAge) {
    return ResponseCookie.from(properties.cookieName(), value)
        .httpOnly(true)
        .secure(properties.secureCookie())
        .sameSite(properties.sameSite())
        .path("/")
        .maxAge(maxAge)
        .build();
  }

  private String signature(String sessionId) {
    try {
      final Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(signingKey);
      final byte[] digest = mac.doFinal(sessionId.getBytes(StandardCharsets.UTF_8));
      return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
    } catch (NoSuchAlgorithmException | InvalidKeyException ex) {
      throw new IllegalStateException("HmacSHA256 is not available", ex);
    }
  }
}
