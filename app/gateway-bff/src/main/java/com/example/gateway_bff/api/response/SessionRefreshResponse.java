package com.example.gateway_bff.api.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record SessionRefreshResponse(
    boolean refreshed, @JsonProperty("expires_at") Instant expiresAt) {}
