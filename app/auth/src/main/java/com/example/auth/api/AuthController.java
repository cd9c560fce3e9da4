/*
 * どこで: app/auth/src/main/java/com/example/auth/api/AuthController.java
 * 何を: ログイン開始/コールバック/トークン検証/トークン延長 API を提供
 * なぜ: 署名鍵を持つ唯一の発行元として認証フローの入口を集約するため
 */
package com.example.auth.api;

import com.example.auth.api.request.TokenRequest;
import com.example.auth.api.response.LoginUrlResponse;
import com.example.auth.api.response.RefreshResponse;
import com.example.auth.api.response.UserClaimsResponse;
import com.example.auth.api.response.VerifyResponse;
import com.example.auth.config.AuthProperties;
import com.example.auth.model.LoginStage;
import com.example.auth.model.RejectReason;
import com.example.auth.service.AuthMetrics;
import com.example.auth.service.LoginRejectedException;
import com.example.auth.service.OidcCallbackService;
import com.example.auth.service.OidcLoginService;
import com.example.common.security.Identity;
import com.example.common.token.SessionClaims;
import com.example.common.token.SessionTokenCodec;
import java.net.URI;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

  private static final Logger logger = LoggerFactory.getLogger(AuthController.class);

  private final OidcLoginService oidcLoginService;
  private final OidcCallbackService oidcCallbackService;
  private final SessionTokenCodec sessionTokenCodec;
  private final AuthProperties authProperties;
  private final AuthMetrics authMetrics;

  /**
   * 役割:
   * - IdP ログインを開始する。
   *
   * 期待動作:
   * - state を 1 件発行し、state を埋め込んだ認可 URL を JSON で返す。
   */
  @GetMapping("/login")
  public ResponseEntity<LoginUrlResponse> login() {
    return ResponseEntity.ok(new LoginUrlResponse(oidcLoginService.beginLogin()));
  }

  /**
   * 役割:
   * - IdP からの callback を処理してセッショントークンを発行する。
   *
   * 期待動作:
   * - 成功時はフロントエンドの /auth/success へ token 付きで 302。
   * - 失敗時は /login へ error=理由コード付きで 302。詳細はログにのみ残す。
   */
  @GetMapping("/callback")
  public ResponseEntity<Void> callback(
      @RequestParam(name = "state", required = false) String state,
      @RequestParam(name = "code", required = false) String code) {
    final UriComponentsBuilder target =
        UriComponentsBuilder.fromUriString(authProperties.frontendUrl());
    try {
      final Identity identity = oidcCallbackService.complete(state, code);
      final String token = sessionTokenCodec.issue(identity);
      logger.info(
          "login completed stage={} subject={}", LoginStage.TOKEN_ISSUED, identity.subjectId());
      authMetrics.recordLoginResult("success");
      target.path("/auth/success").queryParam("token", token);
    } catch (LoginRejectedException ex) {
      authMetrics.recordLoginResult(ex.reason().redirectCode());
      target.path("/login").queryParam("error", ex.reason().redirectCode());
    } catch (RuntimeException ex) {
      logger.error(
          "session token issuance failed after stage={}", LoginStage.IDENTITY_VERIFIED, ex);
      authMetrics.recordLoginResult(RejectReason.INTERNAL_ERROR.redirectCode());
      target.path("/login").queryParam("error", RejectReason.INTERNAL_ERROR.redirectCode());
    }
    return redirect(target.encode().build().toUri());
  }

  /**
   * 役割:
   * - セッショントークンを検証し claims を返す。
   *
   * 期待動作:
   * - 改ざん・期限切れ・形式不正はいずれも 401 {valid:false}。理由は返さない。
   */
  @PostMapping("/verify")
  public ResponseEntity<VerifyResponse> verify(@RequestBody TokenRequest request) {
    final Optional<SessionClaims> claims = sessionTokenCodec.verify(requireToken(request));
    authMetrics.recordTokenResult("verify", claims.isPresent());
    return claims
        .map(c -> ResponseEntity.ok(new VerifyResponse(true, UserClaimsResponse.from(c.identity()))))
        .orElseGet(() -> ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(VerifyResponse.invalid()));
  }

  /**
   * 役割:
   * - 有効なセッショントークンを同じ claims で再発行する。
   *
   * 期待動作:
   * - 現在検証に通るトークンのみ延長する。無効なら 401。
   */
  @PostMapping("/refresh")
  public ResponseEntity<RefreshResponse> refresh(@RequestBody TokenRequest request) {
    final Optional<String> refreshed = sessionTokenCodec.refresh(requireToken(request));
    authMetrics.recordTokenResult("refresh", refreshed.isPresent());
    return refreshed
        .map(token -> ResponseEntity.ok(new RefreshResponse(token)))
        .orElseGet(() -> ResponseEntity.status(HttpStatus.UNAUTHORIZED).build());
  }

  private String requireToken(TokenRequest request) {
    if (request == null || request.token() == null || request.token().isBlank()) {
      throw new IllegalArgumentException("token is required");
    }
    return request.token();
  }

  private ResponseEntity<Void> redirect(URI location) {
    return ResponseEntity.status(HttpStatus.FOUND).location(location).build();
  }
}
