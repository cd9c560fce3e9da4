package com.example.gateway_bff.api;

public record ApiErrorResponse(String code, String message) {}
