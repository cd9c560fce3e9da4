/*
 * どこで: app/gateway-bff/src/main/java/com/example/gateway_bff/api/AuthController.java
 * 何を: ログイン開始/完了、自分情報、セッション延長の API を提供
 * なぜ: ブラウザから見た認証フローの入口を BFF に集約し、トークンを Cookie の外に出さないため
 */
package com.example.gateway_bff.api;

import com.example.gateway_bff.api.response.CsrfTokenResponse;
import com.example.gateway_bff.api.response.LoginStatusResponse;
import com.example.gateway_bff.api.response.MeResponse;
import com.example.gateway_bff.api.response.SessionRefreshResponse;
import com.example.gateway_bff.model.GatewaySession;
import com.example.gateway_bff.model.SessionUser;
import com.example.gateway_bff.service.AuthIntegrationException;
import com.example.gateway_bff.service.AuthServiceClient;
import com.example.gateway_bff.service.GatewayMetrics;
import com.example.gateway_bff.service.SessionCookieManager;
import com.example.gateway_bff.service.SessionService;
import com.example.gateway_bff.service.SessionVerificationService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.net.URI;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.web.csrf.CsrfToken;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

@RestController
@RequiredArgsConstructor
public class AuthController {

  private static final Logger logger = LoggerFactory.getLogger(AuthController.class);

  private static final Map<String, String> LOGIN_ERROR_MESSAGES =
      Map.of(
          "state_mismatch", "Authentication failed due to security check. Please try again.",
          "no_code", "Authentication was cancelled or failed.",
          "token_exchange_failed", "Failed to complete authentication with Google.",
          "invalid_token", "Authentication token is invalid.",
          "internal_error", "An internal error occurred during authentication.",
          "no_token", "No authentication token was received.",
          "auth_service_error", "Authentication service is unavailable. Please try again later.",
          "session_expired", "Your session has expired. Please sign in again.");

  private final AuthServiceClient authServiceClient;
  private final SessionService sessionService;
  private final SessionCookieManager sessionCookieManager;
  private final SessionVerificationService sessionVerificationService;
  private final GatewayMetrics gatewayMetrics;

  /**
   * セッションの有無で /me か /login へ振り分ける。
   *
   * <p>Cookie はあるが検証できないセッションは Cookie を破棄し、session_expired 付きで /login へ戻す。
   */
  @GetMapping("/")
  public ResponseEntity<Void> home(HttpServletRequest request, HttpServletResponse response) {
    if (sessionCookieManager.readCookieValue(request).isEmpty()) {
      return redirect(URI.create("/login"));
    }
    final Optional<GatewaySession> session;
    try {
      session =
          sessionCookieManager
              .resolveSessionId(request)
              .flatMap(sessionVerificationService::verify);
    } catch (AuthIntegrationException ex) {
      logger.warn("session check on home failed reason={}", ex.reason());
      return redirect(URI.create("/login"));
    }
    if (session.isEmpty()) {
      sessionCookieManager.clearSessionCookie(response);
      return redirectToLogin("session_expired");
    }
    return redirect(URI.create("/me"));
  }

  /**
   * ログイン画面の状態を返す。
   *
   * <p>error クエリは既知の理由コードのみメッセージへ変換し、未知のコードは空文字を返す。
   */
  @GetMapping("/login")
  public ResponseEntity<LoginStatusResponse> login(
      @RequestParam(name = "error", required = false) String error) {
    if (error == null || error.isBlank()) {
      return ResponseEntity.ok(new LoginStatusResponse(false, null, null));
    }
    return ResponseEntity.ok(
        new LoginStatusResponse(false, error, LOGIN_ERROR_MESSAGES.getOrDefault(error, "")));
  }

  @GetMapping("/auth/initiate")
  public ResponseEntity<Void> initiate() {
    try {
      return redirect(URI.create(authServiceClient.beginLogin()));
    } catch (AuthIntegrationException | IllegalArgumentException ex) {
      logger.warn("login initiation failed: {}", ex.getMessage());
      gatewayMetrics.recordLoginResult("auth_service_error");
      return redirectToLogin("auth_service_error");
    }
  }

  /**
   * auth-service から戻ったトークンを検証し、サーバー側セッションを発行する。
   *
   * <p>既存セッションがあれば破棄してから新しいセッション ID を払い出す。
   */
  @GetMapping("/auth/success")
  public ResponseEntity<Void> success(
      @RequestParam(name = "token", required = false) String token,
      HttpServletRequest request,
      HttpServletResponse response) {
    if (token == null || token.isBlank()) {
      gatewayMetrics.recordLoginResult("no_token");
      return redirectToLogin("no_token");
    }
    final Optional<SessionUser> user;
    try {
      user = authServiceClient.verify(token);
    } catch (AuthIntegrationException ex) {
      logger.warn("token verification on login failed reason={}", ex.reason());
      gatewayMetrics.recordLoginResult("auth_service_error");
      return redirectToLogin("auth_service_error");
    }
    if (user.isEmpty()) {
      gatewayMetrics.recordLoginResult("invalid_token");
      return redirectToLogin("invalid_token");
    }

    sessionCookieManager.resolveSessionId(request).ifPresent(sessionService::deleteSession);
    final GatewaySession session = sessionService.createSession(token, user.get());
    sessionCookieManager.writeSessionCookie(response, session.sessionId());
    gatewayMetrics.recordLoginResult("success");
    logger.info("gateway session created for sub={}", user.get().sub());
    return redirect(URI.create("/me"));
  }

  @GetMapping("/me")
  public ResponseEntity<MeResponse> me(@AuthenticationPrincipal GatewaySession session) {
    return ResponseEntity.ok(MeResponse.from(session.user()));
  }

  /**
   * 保持中のトークンを auth-service で延長して差し替える。
   *
   * <p>延長を拒否された場合はセッションと Cookie を破棄して 401 を返す。
   */
  @PostMapping("/api/session/refresh")
  public ResponseEntity<SessionRefreshResponse> refresh(
      @AuthenticationPrincipal GatewaySession session, HttpServletResponse response) {
    final Optional<GatewaySession> refreshed =
        authServiceClient
            .refresh(session.token())
            .flatMap(
                token -> sessionService.replaceToken(session.sessionId(), token, session.user()));
    if (refreshed.isEmpty()) {
      logger.info("session refresh rejected for sub={}", session.user().sub());
      sessionService.deleteSession(session.sessionId());
      sessionCookieManager.clearSessionCookie(response);
      return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
    }
    return ResponseEntity.ok(new SessionRefreshResponse(true, refreshed.get().expiresAt()));
  }

  @GetMapping("/csrf")
  public ResponseEntity<CsrfTokenResponse> csrf(CsrfToken csrfToken) {
    if (csrfToken == null) {
      return ResponseEntity.notFound().build();
    }
    return ResponseEntity.ok(
        new CsrfTokenResponse(
            csrfToken.getHeaderName(), csrfToken.getParameterName(), csrfToken.getToken()));
  }

  private ResponseEntity<Void> redirectToLogin(String error) {
    return redirect(
        UriComponentsBuilder.fromPath("/login").queryParam("error", error).build().toUri());
  }

  private ResponseEntity<Void> redirect(URI location) {
    return ResponseEntity.status(HttpStatus.FOUND).location(location).build();
  }
}
