package com.example.auth.api.response;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LoginUrlResponse(@JsonProperty("auth_url") String authUrl) {}
