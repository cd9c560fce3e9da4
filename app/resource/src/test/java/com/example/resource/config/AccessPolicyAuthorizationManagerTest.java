package com.example.resource.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.common.security.AccessPolicy;
import com.example.common.security.Identity;
import com.example.common.security.RequiredRole;
import com.example.common.token.SessionClaims;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.TestingAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

class AccessPolicyAuthorizationManagerTest {

  private final AccessPolicy accessPolicy = new AccessPolicy();
  private final RequestAuthorizationContext context =
      new RequestAuthorizationContext(new MockHttpServletRequest("GET", "/resources/admin"));

  @Test
  void adminRouteAllowsAdminRole() {
    final AccessPolicyAuthorizationManager manager =
        new AccessPolicyAuthorizationManager(accessPolicy, RequiredRole.ADMIN);

    assertThat(manager.check(() -> session("admin"), context).isGranted()).isTrue();
  }

  @Test
  void adminRouteRejectsUserAndUnknownRoles() {
    final AccessPolicyAuthorizationManager manager =
        new AccessPolicyAuthorizationManager(accessPolicy, RequiredRole.ADMIN);

    assertThat(manager.check(() -> session("user"), context).isGranted()).isFalse();
    assertThat(manager.check(() -> session("superuser"), context).isGranted()).isFalse();
    assertThat(manager.check(() -> session("ADMIN"), context).isGranted()).isFalse();
  }

  @Test
  void anyAuthenticatedRouteAllowsEveryVerifiedRole() {
    final AccessPolicyAuthorizationManager manager =
        new AccessPolicyAuthorizationManager(accessPolicy, RequiredRole.ANY_AUTHENTICATED);

    assertThat(manager.check(() -> session("user"), context).isGranted()).isTrue();
    assertThat(manager.check(() -> session("admin"), context).isGranted()).isTrue();
  }

  @Test
  void rejectsAnonymousAndForeignAuthentication() {
    final AccessPolicyAuthorizationManager manager =
        new AccessPolicyAuthorizationManager(accessPolicy, RequiredRole.ANY_AUTHENTICATED);

    assertThat(manager.check(() -> null, context).isGranted()).isFalse();
    assertThat(
            manager
                .check(
                    () ->
                        new AnonymousAuthenticationToken(
                            "key",
                            "anonymousUser",
                            List.of(new SimpleGrantedAuthority("ROLE_ANONYMOUS"))),
                    context)
                .isGranted())
        .isFalse();
    // 検証を経ていない認証情報は admin ロールを持っていても通さない
    assertThat(
            manager
                .check(() -> new TestingAuthenticationToken("x", "y", "ROLE_ADMIN"), context)
                .isGranted())
        .isFalse();
  }

  private static SessionAuthentication session(String role) {
    return new SessionAuthentication(
        new SessionClaims(
            new Identity("sub-1", "a@example.com", "A", null, role),
            Instant.parse("2025-01-01T00:00:00Z"),
            Instant.parse("2025-01-01T08:00:00Z")));
  }
}
