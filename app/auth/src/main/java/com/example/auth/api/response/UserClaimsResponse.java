package com.example.auth.api.response;

import com.example.common.security.Identity;

public record UserClaimsResponse(
    String sub, String email, String name, String role, String picture) {

  public static UserClaimsResponse from(Identity identity) {
    return new UserClaimsResponse(
        identity.subjectId(),
        identity.email(),
        identity.displayName(),
        identity.role(),
        identity.avatarUrl() == null ? "" : identity.avatarUrl());
  }
}
