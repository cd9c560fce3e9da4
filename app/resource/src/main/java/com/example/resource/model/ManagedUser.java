package com.example.resource.model;

import java.time.Instant;

public record ManagedUser(
    long id, String email, String name, String role, Instant lastLogin, String status) {}
