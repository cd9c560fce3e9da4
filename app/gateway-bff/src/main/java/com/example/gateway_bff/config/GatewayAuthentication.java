package com.example.gateway_bff.config;

import com.example.common.security.UserRole;
import com.example.gateway_bff.model.GatewaySession;
import java.util.List;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

/** auth-service で検証済みのセッション。生成は {@link SessionAuthenticationFilter} に限る。 */
public final class GatewayAuthentication extends AbstractAuthenticationToken {

  private final GatewaySession session;

  GatewayAuthentication(GatewaySession session) {
    super(List.of(new SimpleGrantedAuthority(authorityOf(session.user().role()))));
    this.session = session;
    super.setAuthenticated(true);
  }

  @Override
  public GatewaySession getPrincipal() {
    return session;
  }

  @Override
  public Object getCredentials() {
    return null;
  }

  @Override
  public String getName() {
    return session.user().sub();
  }

  @Override
  public void setAuthenticated(boolean authenticated) {
    if (authenticated) {
      throw new IllegalArgumentException("gateway authentication cannot be re-marked as trusted");
    }
    super.setAuthenticated(false);
  }

  private static String authorityOf(String role) {
    return UserRole.fromValue(role) == UserRole.ADMIN ? "ROLE_ADMIN" : "ROLE_USER";
  }
}
