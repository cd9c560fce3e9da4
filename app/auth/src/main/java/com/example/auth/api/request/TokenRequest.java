package com.example.auth.api.request;

public record TokenRequest(String token) {}
