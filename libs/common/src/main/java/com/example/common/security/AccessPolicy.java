package com.example.common.security;

import lombok.NonNull;

/**
 * 検証済み claims と要求ロールから認可可否を判定する。
 *
 * <p>副作用を持たない。ANY_AUTHENTICATED は検証済みであれば常に許可し、ADMIN は role が "admin"
 * の場合のみ許可する。
 */
public class AccessPolicy {

  public AccessDecision evaluate(@NonNull Identity claims, @NonNull RequiredRole requiredRole) {
    final boolean allowed =
        switch (requiredRole) {
          case ANY_AUTHENTICATED -> true;
          case ADMIN -> UserRole.fromValue(claims.role()) == UserRole.ADMIN;
        };
    return new AccessDecision(claims, requiredRole, allowed);
  }

  public boolean authorize(@NonNull Identity claims, @NonNull RequiredRole requiredRole) {
    return evaluate(claims, requiredRole).allowed();
  }
}
