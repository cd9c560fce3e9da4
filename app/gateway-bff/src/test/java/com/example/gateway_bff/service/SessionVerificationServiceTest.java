package com.example.gateway_bff.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.gateway_bff.model.GatewaySession;
import com.example.gateway_bff.model.SessionUser;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionVerificationServiceTest {

  private static final SessionUser USER =
      new SessionUser("google-sub-1", "user@example.com", "User", "user", "");

  @Mock private AuthServiceClient authServiceClient;

  private SessionService sessionService;
  private SessionVerificationService verificationService;

  @BeforeEach
  void setUp() {
    sessionService =
        new SessionService(
            new MutableClock(Instant.parse("2025-01-01T00:00:00Z")), Duration.ofHours(8));
    verificationService = new SessionVerificationService(sessionService, authServiceClient);
  }

  @Test
  void returnsSessionWithUserConfirmedByAuth() {
    final GatewaySession session = sessionService.createSession("token-1", USER);
    final SessionUser promoted =
        new SessionUser("google-sub-1", "user@example.com", "User", "admin", "");
    when(authServiceClient.verify("token-1")).thenReturn(Optional.of(promoted));

    final Optional<GatewaySession> verified = verificationService.verify(session.sessionId());

    assertThat(verified)
        .hasValueSatisfying(
            s -> {
              assertThat(s.user().role()).isEqualTo("admin");
              assertThat(s.expiresAt()).isEqualTo(session.expiresAt());
            });
  }

  @Test
  void rejectedTokenDropsSession() {
    final GatewaySession session = sessionService.createSession("token-1", USER);
    when(authServiceClient.verify("token-1")).thenReturn(Optional.empty());

    assertThat(verificationService.verify(session.sessionId())).isEmpty();
    assertThat(sessionService.findSession(session.sessionId())).isEmpty();
  }

  @Test
  void unknownSessionDoesNotCallAuth() {
    assertThat(verificationService.verify("missing")).isEmpty();
    verifyNoInteractions(authServiceClient);
  }

  @Test
  void authOutageKeepsSession() {
    final GatewaySession session = sessionService.createSession("token-1", USER);
    when(authServiceClient.verify("token-1"))
        .thenThrow(
            new AuthIntegrationException(AuthIntegrationException.Reason.TIMEOUT, "timeout"));

    assertThatThrownBy(() -> verificationService.verify(session.sessionId()))
        .isInstanceOf(AuthIntegrationException.class);
    assertThat(sessionService.findSession(session.sessionId())).isPresent();
  }
}
