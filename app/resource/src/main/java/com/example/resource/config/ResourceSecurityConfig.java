package com.example.resource.config;

import com.example.common.security.AccessPolicy;
import com.example.common.security.RequiredRole;
import com.example.common.token.SessionTokenCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;

@Configuration
public class ResourceSecurityConfig {

  @Bean
  AccessPolicy accessPolicy() {
    return new AccessPolicy();
  }

  @Bean
  BearerTokenAuthenticationFilter bearerTokenAuthenticationFilter(
      SessionTokenCodec sessionTokenCodec) {
    return new BearerTokenAuthenticationFilter(sessionTokenCodec);
  }

  // Security チェーン内でのみ動かす。サーブレットフィルタとしての自動登録は止める
  @Bean
  FilterRegistrationBean<BearerTokenAuthenticationFilter> bearerTokenFilterRegistration(
      BearerTokenAuthenticationFilter filter) {
    final FilterRegistrationBean<BearerTokenAuthenticationFilter> registration =
        new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  JsonSecurityErrorHandler jsonSecurityErrorHandler(ObjectMapper objectMapper) {
    return new JsonSecurityErrorHandler(objectMapper);
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http,
      BearerTokenAuthenticationFilter bearerTokenAuthenticationFilter,
      JsonSecurityErrorHandler jsonSecurityErrorHandler,
      AccessPolicy accessPolicy)
      throws Exception {
    final AccessPolicyAuthorizationManager anyAuthenticated =
        new AccessPolicyAuthorizationManager(accessPolicy, RequiredRole.ANY_AUTHENTICATED);
    final AccessPolicyAuthorizationManager adminOnly =
        new AccessPolicyAuthorizationManager(accessPolicy, RequiredRole.ADMIN);

    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(bearerTokenAuthenticationFilter, AuthorizationFilter.class)
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
                    .requestMatchers(HttpMethod.GET, "/resources/admin")
                    .access(adminOnly)
                    .requestMatchers("/admin/**")
                    .access(adminOnly)
                    .anyRequest()
                    .access(anyAuthenticated))
        .exceptionHandling(
            ex ->
                ex.authenticationEntryPoint(jsonSecurityErrorHandler)
                    .accessDeniedHandler(jsonSecurityErrorHandler));
    return http.build();
  }
}
