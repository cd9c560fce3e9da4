/*
 * どこで: app/resource/src/main/java/com/example/resource/config/SessionAuthentication.java
 * 何を: 署名と期限の検証を通過したセッショントークンの認証情報
 * なぜ: 未検証の claims から認可判定を行う経路を型で塞ぐため
 */
package com.example.resource.config;

import com.example.common.security.UserRole;
import com.example.common.token.SessionClaims;
import java.util.List;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

/**
 * principal は {@link SessionClaims}。生成は同一パッケージの {@link BearerTokenAuthenticationFilter}
 * に限る。
 */
public final class SessionAuthentication extends AbstractAuthenticationToken {

  private final SessionClaims claims;

  SessionAuthentication(SessionClaims claims) {
    super(List.of(new SimpleGrantedAuthority(authorityOf(claims.role()))));
    this.claims = claims;
    super.setAuthenticated(true);
  }

  public SessionClaims claims() {
    return claims;
  }

  @Override
  public Object getPrincipal() {
    return claims;
  }

  // トークン本体は保持しない
  @Override
  public Object getCredentials() {
    return null;
  }

  @Override
  public String getName() {
    return claims.subjectId();
  }

  @Override
  public void setAuthenticated(boolean authenticated) {
    if (authenticated) {
      throw new IllegalArgumentException("session authentication cannot be re-marked as trusted");
    }
    super.setAuthenticated(false);
  }

  private static String authorityOf(String role) {
    return UserRole.fromValue(role) == UserRole.ADMIN ? "ROLE_ADMIN" : "ROLE_USER";
  }
}
