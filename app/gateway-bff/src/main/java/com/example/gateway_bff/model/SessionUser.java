package com.example.gateway_bff.model;

/** auth-service の /auth/verify が返した利用者 claims。 */
public record SessionUser(String sub, String email, String name, String role, String picture) {}
