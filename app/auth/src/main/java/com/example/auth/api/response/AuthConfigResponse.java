package com.example.auth.api.response;

import com.fasterxml.jackson.annotation.JsonProperty;

// client_secret は含めない
public record AuthConfigResponse(
    @JsonProperty("client_id") String clientId,
    @JsonProperty("redirect_uri") String redirectUri,
    @JsonProperty("auth_uri") String authUri,
    @JsonProperty("token_uri") String tokenUri,
    String scope,
    @JsonProperty("frontend_url") String frontendUrl) {}
