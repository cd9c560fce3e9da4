/*
 * どこで: app/auth/src/main/java/com/example/auth/model/LoginAttempt.java
 * 何を: /auth/login で発行した state の記録
 * なぜ: /auth/callback で CSRF/replay 検証を行うため
 */
package com.example.auth.model;

import java.time.Duration;
import java.time.Instant;

public record LoginAttempt(String stateToken, Instant createdAt, boolean consumed) {

  public static LoginAttempt issued(String stateToken, Instant createdAt) {
    return new LoginAttempt(stateToken, createdAt, false);
  }

  public LoginAttempt markConsumed() {
    return new LoginAttempt(stateToken, createdAt, true);
  }

  // 境界(ちょうど ttl 経過)はまだ有効とする
  public boolean isExpired(Instant now, Duration ttl) {
    return Duration.between(createdAt, now).compareTo(ttl) > 0;
  }
}
