/*
 * どこで: libs/common/src/main/java/com/example/common/security/Identity.java
 * 何を: IdP で検証済みのユーザー属性とロール
 * なぜ: ログイン完了からトークン発行までを永続化なしで受け渡すため
 */
package com.example.common.security;

public record Identity(
    String subjectId, String email, String displayName, String avatarUrl, String role) {

  public Identity {
    if (subjectId == null || subjectId.isBlank()) {
      throw new IllegalArgumentException("subjectId is required");
    }
    if (email == null || email.isBlank()) {
      throw new IllegalArgumentException("email is required");
    }
    role = role == null || role.isBlank() ? UserRole.USER.value() : role;
  }
}
