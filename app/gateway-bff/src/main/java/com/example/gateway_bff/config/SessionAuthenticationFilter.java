package com.example.gateway_bff.config;

import com.example.gateway_bff.model.GatewaySession;
import com.example.gateway_bff.service.AuthIntegrationException;
import com.example.gateway_bff.service.SessionCookieManager;
import com.example.gateway_bff.service.SessionVerificationService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerExceptionResolver;

/**
 * セッション Cookie から {@link GatewayAuthentication} を組み立てる。対象は /me と /api/** のみ。
 *
 * <p>Cookie が無い・署名不一致・トークン無効のときは認証情報を設定せずに後続へ流す(401 は entry point)。
 * 無効なセッションと Cookie はここで破棄する。auth-service 障害は例外ハンドラへ委譲する。
 */
public class SessionAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger = LoggerFactory.getLogger(SessionAuthenticationFilter.class);

  private final SessionCookieManager sessionCookieManager;
  private final SessionVerificationService sessionVerificationService;
  private final HandlerExceptionResolver handlerExceptionResolver;

  public SessionAuthenticationFilter(
      SessionCookieManager sessionCookieManager,
      SessionVerificationService sessionVerificationService,
      HandlerExceptionResolver handlerExceptionResolver) {
    this.sessionCookieManager = sessionCookieManager;
    this.sessionVerificationService = sessionVerificationService;
    this.handlerExceptionResolver = handlerExceptionResolver;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri == null || !(uri.equals("/me") || uri.startsWith("/api/"));
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final Optional<String> cookieValue = sessionCookieManager.readCookieValue(request);
    if (cookieValue.isEmpty()) {
      filterChain.doFilter(request, response);
      return;
    }
    final Optional<String> sessionId = sessionCookieManager.verify(cookieValue.get());
    if (sessionId.isEmpty()) {
      logger.info("session cookie rejected for path={}", request.getRequestURI());
      sessionCookieManager.clearSessionCookie(response);
      filterChain.doFilter(request, response);
      return;
    }

    final Optional<GatewaySession> session;
    try {
      session = sessionVerificationService.verify(sessionId.get());
    } catch (AuthIntegrationException ex) {
      if (handlerExceptionResolver.resolveException(request, response, null, ex) == null) {
        response.sendError(HttpServletResponse.SC_SERVICE_UNAVAILABLE);
      }
      return;
    }
    if (session.isEmpty()) {
      sessionCookieManager.clearSessionCookie(response);
      filterChain.doFilter(request, response);
      return;
    }
    SecurityContextHolder.getContext().setAuthentication(new GatewayAuthentication(session.get()));
    filterChain.doFilter(request, response);
  }
}
