package com.example.auth.service;

import com.example.auth.config.AuthProperties;
import com.example.auth.model.LoginAttempt;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * anti-replay 用 state の発行と消費。
 *
 * <p>state は 1 回だけ、かつ発行から ttl 以内に限り受理する。期限切れの記録はタイマーを使わず、issue/consume
 * の呼び出し時にまとめて掃除する。
 */
@Service
public class LoginStateService {

  private static final Logger logger = LoggerFactory.getLogger(LoginStateService.class);
  private static final int STATE_BYTES = 32;

  private final LoginStateStore store;
  private final Clock clock;
  private final Duration ttl;
  private final SecureRandom secureRandom = new SecureRandom();

  @Autowired
  public LoginStateService(LoginStateStore store, Clock clock, AuthProperties properties) {
    this(store, clock, properties.stateTtl());
  }

  public LoginStateService(LoginStateStore store, Clock clock, Duration ttl) {
    this.store = store;
    this.clock = clock;
    this.ttl = ttl;
  }

  public String issue() {
    sweepExpired();
    final byte[] random = new byte[STATE_BYTES];
    secureRandom.nextBytes(random);
    final String stateToken = HexFormat.of().formatHex(random);
    store.save(LoginAttempt.issued(stateToken, Instant.now(clock)));
    return stateToken;
  }

  /**
   * state を消費する。
   *
   * @return 未消費かつ期限内だった場合のみ true。未登録・消費済み・期限切れは呼び出し側から区別できない
   */
  public boolean consume(String stateToken) {
    if (stateToken == null || stateToken.isBlank()) {
      return false;
    }
    sweepExpired();
    final Optional<LoginAttempt> claimed = store.claim(stateToken);
    if (claimed.isEmpty()) {
      logger.debug("state rejected: unknown or already consumed");
      return false;
    }
    // sweep と claim の間に期限を跨いだ場合もここで弾く
    if (claimed.get().isExpired(Instant.now(clock), ttl)) {
      logger.debug("state rejected: expired (created_at={})", claimed.get().createdAt());
      return false;
    }
    return true;
  }

  public int outstandingCount() {
    sweepExpired();
    return store.size();
  }

  private void sweepExpired() {
    final int removed = store.purgeCreatedBefore(Instant.now(clock).minus(ttl));
    if (removed > 0) {
      logger.debug("purged {} expired login states", removed);
    }
  }
}
