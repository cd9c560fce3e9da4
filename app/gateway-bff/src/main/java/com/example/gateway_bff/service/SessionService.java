package com.example.gateway_bff.service;

import com.example.gateway_bff.config.SessionProperties;
import com.example.gateway_bff.model.GatewaySession;
import com.example.gateway_bff.model.SessionUser;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class SessionService {

  private static final int SESSION_ID_BYTES = 32;

  private final Clock clock;
  private final Duration ttl;
  private final SecureRandom secureRandom = new SecureRandom();
  private final Map<String, GatewaySession> sessions = new ConcurrentHashMap<>();

  @Autowired
  public SessionService(Clock clock, SessionProperties properties) {
    this(clock, properties.ttl());
  }

  public SessionService(Clock clock, Duration ttl) {
    this.clock = clock;
    this.ttl = ttl;
  }

  public GatewaySession createSession(String token, SessionUser user) {
    purgeExpired();
    final byte[] random = new byte[SESSION_ID_BYTES];
    secureRandom.nextBytes(random);
    final String sessionId = HexFormat.of().formatHex(random);
    final GatewaySession session =
        new GatewaySession(sessionId, token, user, Instant.now(clock).plus(ttl));
    sessions.put(sessionId, session);
    return session;
  }

  public Optional<GatewaySession> findSession(String sessionId) {
    if (sessionId == null) {
      return Optional.empty();
    }
    final GatewaySession session = sessions.get(sessionId);
    if (session == null) {
      return Optional.empty();
    }
    if (session.isExpired(Instant.now(clock))) {
      sessions.remove(sessionId);
      return Optional.empty();
    }
    return Optional.of(session);
  }

  /** 延長したトークンへ差し替え、有効期限も延ばす。セッションが既に無い場合は empty。 */
  public Optional<GatewaySession> replaceToken(String sessionId, String token, SessionUser user) {
    final Instant expiresAt = Instant.now(clock).plus(ttl);
    return Optional.ofNullable(
        sessions.computeIfPresent(
            sessionId, (key, current) -> current.withToken(token, user, expiresAt)));
  }

  public void deleteSession(String sessionId) {
    if (sessionId != null) {
      sessions.remove(sessionId);
    }
  }

  private void purgeExpired() {
    final Instant now = Instant.now(clock);
    sessions.values().removeIf(session -> session.isExpired(now));
  }
}
