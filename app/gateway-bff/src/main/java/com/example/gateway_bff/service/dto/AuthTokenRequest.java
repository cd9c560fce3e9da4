package com.example.gateway_bff.service.dto;

public record AuthTokenRequest(String token) {}
