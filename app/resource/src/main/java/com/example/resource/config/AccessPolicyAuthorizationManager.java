package com.example.resource.config;

import com.example.common.security.AccessDecision;
import com.example.common.security.AccessPolicy;
import com.example.common.security.RequiredRole;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

/** 経路ごとの要求ロールを AccessPolicy で判定する。SessionAuthentication 以外は常に拒否。 */
public class AccessPolicyAuthorizationManager
    implements AuthorizationManager<RequestAuthorizationContext> {

  private static final Logger logger =
      LoggerFactory.getLogger(AccessPolicyAuthorizationManager.class);

  private final AccessPolicy accessPolicy;
  private final RequiredRole requiredRole;

  public AccessPolicyAuthorizationManager(AccessPolicy accessPolicy, RequiredRole requiredRole) {
    this.accessPolicy = accessPolicy;
    this.requiredRole = requiredRole;
  }

  @Override
  public AuthorizationDecision check(
      Supplier<Authentication> authentication, RequestAuthorizationContext context) {
    final Authentication auth = authentication.get();
    if (!(auth instanceof SessionAuthentication session) || !session.isAuthenticated()) {
      return new AuthorizationDecision(false);
    }
    final AccessDecision decision =
        accessPolicy.evaluate(session.claims().identity(), requiredRole);
    if (!decision.allowed()) {
      logger.info(
          "access denied subject={} role={} required={} path={}",
          decision.subject().subjectId(),
          decision.subject().role(),
          decision.requiredRole(),
          context.getRequest().getRequestURI());
    }
    return new AuthorizationDecision(decision.allowed());
  }
}
