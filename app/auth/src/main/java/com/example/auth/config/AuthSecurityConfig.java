package com.example.auth.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;

/**
 * auth-service は利用者セッションを持たない。
 *
 * <p>/auth/verify と /auth/refresh はリクエスト本文のトークンで判定するため、フィルタ層では公開エンドポイ
 * ントのみを列挙し、それ以外は拒否する。
 */
@Configuration
public class AuthSecurityConfig {

  @Bean
  SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/health",
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    .requestMatchers(HttpMethod.GET, "/auth/login", "/auth/callback")
                    .permitAll()
                    .requestMatchers(HttpMethod.POST, "/auth/verify", "/auth/refresh")
                    .permitAll()
                    .requestMatchers(HttpMethod.GET, "/auth/config", "/auth/debug")
                    .permitAll()
                    .anyRequest()
                    .denyAll())
        .exceptionHandling(
            ex -> ex.authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)));
    return http.build();
  }
}
