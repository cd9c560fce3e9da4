package com.example.auth.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerifyResponse(boolean valid, UserClaimsResponse user) {

  public static VerifyResponse invalid() {
    return new VerifyResponse(false, null);
  }
}
