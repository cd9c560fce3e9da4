package com.example.resource.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;

/** 認証失敗を 401、ロール不足を 403 として {"error": ...} で返す。 */
public class JsonSecurityErrorHandler implements AuthenticationEntryPoint, AccessDeniedHandler {

  static final String MISSING_TOKEN = "Missing or invalid token";
  static final String INVALID_TOKEN = "Invalid or expired token";
  static final String ADMIN_REQUIRED = "Admin access required";

  private final ObjectMapper objectMapper;

  public JsonSecurityErrorHandler(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public void commence(
      HttpServletRequest request,
      HttpServletResponse response,
      AuthenticationException authException)
      throws IOException {
    final Object failure = request.getAttribute(BearerTokenAuthenticationFilter.FAILURE_ATTRIBUTE);
    final String message =
        failure == BearerTokenAuthenticationFilter.Failure.INVALID ? INVALID_TOKEN : MISSING_TOKEN;
    write(response, HttpServletResponse.SC_UNAUTHORIZED, message);
  }

  @Override
  public void handle(
      HttpServletRequest request,
      HttpServletResponse response,
      AccessDeniedException accessDeniedException)
      throws IOException {
    write(response, HttpServletResponse.SC_FORBIDDEN, ADMIN_REQUIRED);
  }

  private void write(HttpServletResponse response, int status, String message)
      throws IOException {
    response.setStatus(status);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(), Map.of("error", message));
  }
}
