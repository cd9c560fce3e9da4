/*
 * どこで: app/auth/src/main/java/com/example/auth/model/OidcClaims.java
 * 何を: 検証済み id_token から抽出した主要 claims を保持するモデル
 * なぜ: トークン処理とロール解決を分離してテストしやすくするため
 */
package com.example.auth.model;

public record OidcClaims(String subject, String email, String name, String picture) {}
