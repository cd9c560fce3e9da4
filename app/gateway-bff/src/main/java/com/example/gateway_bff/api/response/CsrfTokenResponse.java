package com.example.gateway_bff.api.response;

public record CsrfTokenResponse(String headerName, String parameterName, String token) {}
