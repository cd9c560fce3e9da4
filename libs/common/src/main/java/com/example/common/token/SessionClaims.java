/*
 * どこで: libs/common/src/main/java/com/example/common/token/SessionClaims.java
 * 何を: 署名検証と期限確認を通過したセッショントークンの claims
 * なぜ: 未検証の claims を業務処理へ渡さないため、SessionTokenCodec のみが生成する
 */
package com.example.common.token;

import com.example.common.security.Identity;
import java.time.Instant;

public record SessionClaims(Identity identity, Instant issuedAt, Instant expiresAt) {

  public String subjectId() {
    return identity.subjectId();
  }

  public String email() {
    return identity.email();
  }

  public String role() {
    return identity.role();
  }
}
