package com.example.gateway_bff.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.gateway_bff.model.GatewaySession;
import com.example.gateway_bff.model.SessionUser;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class SessionServiceTest {

  private static final SessionUser USER =
      new SessionUser("google-sub-1", "user@example.com", "User", "user", "");

  private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
  private final SessionService service = new SessionService(clock, Duration.ofHours(8));

  @Test
  void createFindDeleteSession() {
    final GatewaySession session = service.createSession("token-1", USER);

    assertThat(session.sessionId()).hasSize(64);
    assertThat(service.findSession(session.sessionId()))
        .hasValueSatisfying(found -> assertThat(found.token()).isEqualTo("token-1"));

    service.deleteSession(session.sessionId());

    assertThat(service.findSession(session.sessionId())).isEmpty();
  }

  @Test
  void sessionIdsAreNotReused() {
    final GatewaySession first = service.createSession("token-1", USER);
    final GatewaySession second = service.createSession("token-1", USER);

    assertThat(first.sessionId()).isNotEqualTo(second.sessionId());
  }

  @Test
  void expiredSessionIsNotReturned() {
    final GatewaySession session = service.createSession("token-1", USER);

    clock.advance(Duration.ofHours(8));

    assertThat(service.findSession(session.sessionId())).isEmpty();
  }

  @Test
  void replaceTokenSwapsTokenAndExtendsExpiry() {
    final GatewaySession session = service.createSession("token-1", USER);
    clock.advance(Duration.ofHours(7));

    final GatewaySession replaced =
        service.replaceToken(session.sessionId(), "token-2", USER).orElseThrow();

    assertThat(replaced.token()).isEqualTo("token-2");
    assertThat(replaced.expiresAt()).isEqualTo(session.expiresAt().plus(Duration.ofHours(7)));
    clock.advance(Duration.ofHours(2));
    assertThat(service.findSession(session.sessionId()))
        .hasValueSatisfying(found -> assertThat(found.token()).isEqualTo("token-2"));
  }

  @Test
  void replaceTokenOnDeletedSessionReturnsEmpty() {
    final GatewaySession session = service.createSession("token-1", USER);
    service.deleteSession(session.sessionId());

    assertThat(service.replaceToken(session.sessionId(), "token-2", USER)).isEmpty();
    assertThat(service.findSession(session.sessionId())).isEmpty();
  }

  @Test
  void unknownOrNullSessionIdReturnsEmpty() {
    assertThat(service.findSession("missing")).isEmpty();
    assertThat(service.findSession(null)).isEmpty();
  }
}
