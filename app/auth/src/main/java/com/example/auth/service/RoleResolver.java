package com.example.auth.service;

import com.example.auth.config.AuthProperties;
import com.example.common.security.UserRole;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

// メールアドレス → ロールの全域関数。表にないアドレスは user。
@Component
@RequiredArgsConstructor
public class RoleResolver {

  private final AuthProperties properties;

  public String resolve(String email) {
    if (email == null) {
      return UserRole.USER.value();
    }
    final String role = properties.roles().get(email.trim().toLowerCase(Locale.ROOT));
    return role == null || role.isBlank() ? UserRole.USER.value() : role;
  }
}
