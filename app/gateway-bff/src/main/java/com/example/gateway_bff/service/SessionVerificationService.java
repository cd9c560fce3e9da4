package com.example.gateway_bff.service;

import com.example.gateway_bff.model.GatewaySession;
import com.example.gateway_bff.model.SessionUser;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * セッションが保持するトークンを auth-service で再検証する。
 *
 * <p>無効と判定されたセッションはその場で破棄する。auth-service 自体の障害は {@link AuthIntegrationException}
 * のまま呼び出し元へ伝播させ、セッションは残す。
 */
@Service
@RequiredArgsConstructor
public class SessionVerificationService {

  private static final Logger logger = LoggerFactory.getLogger(SessionVerificationService.class);

  private final SessionService sessionService;
  private final AuthServiceClient authServiceClient;

  public Optional<GatewaySession> verify(String sessionId) {
    final Optional<GatewaySession> session = sessionService.findSession(sessionId);
    if (session.isEmpty()) {
      return Optional.empty();
    }
    final GatewaySession current = session.get();
    final Optional<SessionUser> user = authServiceClient.verify(current.token());
    if (user.isEmpty()) {
      logger.info("session token rejected by auth service; dropping session");
      sessionService.deleteSession(sessionId);
      return Optional.empty();
    }
    return Optional.of(current.withToken(current.token(), user.get(), current.expiresAt()));
  }
}
