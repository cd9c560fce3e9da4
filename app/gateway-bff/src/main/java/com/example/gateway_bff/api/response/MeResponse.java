package com.example.gateway_bff.api.response;

import com.example.gateway_bff.model.SessionUser;

public record MeResponse(String sub, String email, String name, String role, String picture) {

  public static MeResponse from(SessionUser user) {
    return new MeResponse(
        user.sub(),
        user.email(),
        user.name(),
        user.role(),
        user.picture() == null ? "" : user.picture());
  }
}
