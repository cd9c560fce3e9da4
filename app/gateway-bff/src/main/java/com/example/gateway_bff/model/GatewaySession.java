/*
 * どこで: app/gateway-bff/src/main/java/com/example/gateway_bff/model/GatewaySession.java
 * 何を: BFF が保持するサーバー側セッション
 * なぜ: セッショントークンをブラウザへ渡さず、Cookie にはセッション ID のみを載せるため
 */
package com.example.gateway_bff.model;

import java.time.Instant;

public record GatewaySession(String sessionId, String token, SessionUser user, Instant expiresAt) {

  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }

  public GatewaySession withToken(String newToken, SessionUser newUser, Instant newExpiresAt) {
    return new GatewaySession(sessionId, newToken, newUser, newExpiresAt);
  }
}
