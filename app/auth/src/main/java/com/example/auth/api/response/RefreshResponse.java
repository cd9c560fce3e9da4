package com.example.auth.api.response;

public record RefreshResponse(String token) {}
