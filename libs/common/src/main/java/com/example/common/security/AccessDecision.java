package com.example.common.security;

public record AccessDecision(Identity subject, RequiredRole requiredRole, boolean allowed) {}
