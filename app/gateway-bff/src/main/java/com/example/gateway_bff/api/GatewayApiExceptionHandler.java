package com.example.gateway_bff.api;

import com.example.gateway_bff.service.AuthIntegrationException;
import com.example.gateway_bff.service.GatewayMetrics;
import com.example.gateway_bff.service.ResourceIntegrationException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@RequiredArgsConstructor
public class GatewayApiExceptionHandler {

  private final GatewayMetrics gatewayMetrics;

  @ExceptionHandler(AuthIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleAuthIntegration(AuthIntegrationException ex) {
    final String code =
        switch (ex.reason()) {
          case UNAUTHORIZED -> "AUTH_UNAUTHORIZED";
          case FORBIDDEN -> "AUTH_FORBIDDEN";
          case TIMEOUT -> "AUTH_TIMEOUT";
          case INVALID_RESPONSE -> "AUTH_INVALID_RESPONSE";
          case BAD_GATEWAY -> "AUTH_UNAVAILABLE";
        };
    final HttpStatus status =
        switch (ex.reason()) {
          case TIMEOUT, BAD_GATEWAY -> HttpStatus.SERVICE_UNAVAILABLE;
          case UNAUTHORIZED, FORBIDDEN, INVALID_RESPONSE -> HttpStatus.BAD_GATEWAY;
        };
    gatewayMetrics.recordIntegrationError(code);
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, ex.getMessage()));
  }

  @ExceptionHandler(ResourceIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleResourceIntegration(
      ResourceIntegrationException ex) {
    final String code =
        switch (ex.reason()) {
          case TIMEOUT -> "RESOURCE_TIMEOUT";
          case INVALID_RESPONSE -> "RESOURCE_INVALID_RESPONSE";
          case BAD_GATEWAY -> "RESOURCE_UNAVAILABLE";
        };
    final HttpStatus status =
        switch (ex.reason()) {
          case TIMEOUT, BAD_GATEWAY -> HttpStatus.SERVICE_UNAVAILABLE;
          case INVALID_RESPONSE -> HttpStatus.BAD_GATEWAY;
        };
    gatewayMetrics.recordIntegrationError(code);
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, ex.getMessage()));
  }
}
