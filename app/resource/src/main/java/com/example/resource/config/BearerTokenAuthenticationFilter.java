package com.example.resource.config;

import com.example.common.token.SessionClaims;
import com.example.common.token.SessionTokenCodec;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authorization: Bearer のセッショントークンを検証し、成功時のみ {@link SessionAuthentication} を設定する。
 *
 * <p>失敗時は認証情報を設定せずに後続へ流し、拒否は AuthorizationFilter と entry point に任せる。失敗区分は
 * {@link #FAILURE_ATTRIBUTE} に残す。
 */
public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(BearerTokenAuthenticationFilter.class);

  public static final String FAILURE_ATTRIBUTE =
      BearerTokenAuthenticationFilter.class.getName() + ".FAILURE";

  private static final String BEARER_PREFIX = "Bearer ";
  private static final Set<String> PUBLIC_PATHS = Set.of("/health", "/error");

  public enum Failure {
    MISSING,
    INVALID
  }

  private final SessionTokenCodec sessionTokenCodec;

  public BearerTokenAuthenticationFilter(SessionTokenCodec sessionTokenCodec) {
    this.sessionTokenCodec = sessionTokenCodec;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri == null || PUBLIC_PATHS.contains(uri) || uri.startsWith("/actuator/");
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String header = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (header == null || !header.startsWith(BEARER_PREFIX)) {
      request.setAttribute(FAILURE_ATTRIBUTE, Failure.MISSING);
      filterChain.doFilter(request, response);
      return;
    }
    final Optional<SessionClaims> claims =
        sessionTokenCodec.verify(header.substring(BEARER_PREFIX.length()).trim());
    if (claims.isPresent()) {
      final SessionAuthentication authentication = new SessionAuthentication(claims.get());
      logger.debug(
          "bearer authentication established for path={} authorities={}",
          request.getRequestURI(),
          authentication.getAuthorities());
      SecurityContextHolder.getContext().setAuthentication(authentication);
    } else {
      logger.debug("bearer token rejected for path={}", request.getRequestURI());
      request.setAttribute(FAILURE_ATTRIBUTE, Failure.INVALID);
    }
    filterChain.doFilter(request, response);
  }
}
