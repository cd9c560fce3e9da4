package com.example.resource.model;

import java.time.Instant;

/** 公開対象のサンプル資源。sensitive は管理者専用資源を表す。 */
public record ResourceItem(
    long id, String title, String content, String type, Instant createdAt, boolean sensitive) {}
