package com.example.resource.api.response;

import com.example.resource.model.ManagedUser;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record ManagedUserResponse(
    long id,
    String email,
    String name,
    String role,
    @JsonProperty("last_login") Instant lastLogin,
    String status) {

  public static ManagedUserResponse from(ManagedUser user) {
    return new ManagedUserResponse(
        user.id(), user.email(), user.name(), user.role(), user.lastLogin(), user.status());
  }
}
