package com.example.gateway_bff.config;

import com.example.gateway_bff.service.SessionCookieManager;
import com.example.gateway_bff.service.SessionService;
import com.example.gateway_bff.service.SessionVerificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.logout.HttpStatusReturningLogoutSuccessHandler;
import org.springframework.security.web.authentication.logout.LogoutHandler;
import org.springframework.web.servlet.HandlerExceptionResolver;

@Configuration
public class GatewaySecurityConfig {
  private static final Logger logger = LoggerFactory.getLogger(GatewaySecurityConfig.class);
  private final boolean csrfEnabled;

  public GatewaySecurityConfig(@Value("${app.security.csrf-enabled:true}") boolean csrfEnabled) {
    this.csrfEnabled = csrfEnabled;
  }

  @Bean
  SessionAuthenticationFilter sessionAuthenticationFilter(
      SessionCookieManager sessionCookieManager,
      SessionVerificationService sessionVerificationService,
      @Qualifier("handlerExceptionResolver") HandlerExceptionResolver handlerExceptionResolver) {
    return new SessionAuthenticationFilter(
        sessionCookieManager, sessionVerificationService, handlerExceptionResolver);
  }

  // SecurityFilterChain 内でのみ動かす
  @Bean
  FilterRegistrationBean<SessionAuthenticationFilter> sessionAuthenticationFilterRegistration(
      SessionAuthenticationFilter filter) {
    final FilterRegistrationBean<SessionAuthenticationFilter> registration =
        new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http,
      SessionAuthenticationFilter sessionAuthenticationFilter,
      SessionCookieManager sessionCookieManager,
      SessionService sessionService)
      throws Exception {
    if (csrfEnabled) {
      http.csrf(Customizer.withDefaults());
    } else {
      http.csrf(csrf -> csrf.disable());
    }
    http.sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.IF_REQUIRED))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/",
                        "/login",
                        "/auth/initiate",
                        "/auth/success",
                        "/csrf",
                        "/health",
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    .requestMatchers("/me", "/api/**")
                    .authenticated()
                    .anyRequest()
                    .authenticated())
        .addFilterBefore(sessionAuthenticationFilter, AuthorizationFilter.class)
        .exceptionHandling(ex -> ex.authenticationEntryPoint(authenticationEntryPoint()))
        .logout(
            logout ->
                logout
                    .logoutUrl("/logout")
                    .addLogoutHandler(sessionLogoutHandler(sessionCookieManager, sessionService))
                    .logoutSuccessHandler(
                        new HttpStatusReturningLogoutSuccessHandler(HttpStatus.NO_CONTENT))
                    .invalidateHttpSession(true)
                    .deleteCookies("JSESSIONID"));

    return http.build();
  }

  @Bean
  AuthenticationEntryPoint authenticationEntryPoint() {
    return new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED);
  }

  // セッションが無くても Cookie は必ず消す
  private LogoutHandler sessionLogoutHandler(
      SessionCookieManager sessionCookieManager, SessionService sessionService) {
    return (request, response, authentication) -> {
      sessionCookieManager
          .resolveSessionId(request)
          .ifPresent(
              sessionId -> {
                sessionService.deleteSession(sessionId);
                logger.info("gateway session deleted on logout");
              });
      sessionCookieManager.clearSessionCookie(response);
    };
  }
}
