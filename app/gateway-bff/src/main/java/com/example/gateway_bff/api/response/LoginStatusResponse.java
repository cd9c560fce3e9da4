package com.example.gateway_bff.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoginStatusResponse(boolean authenticated, String error, String message) {}
