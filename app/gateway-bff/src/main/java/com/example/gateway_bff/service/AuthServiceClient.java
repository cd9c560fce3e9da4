package com.example.gateway_bff.service;

import com.example.gateway_bff.config.AuthServiceClientProperties;
import com.example.gateway_bff.model.SessionUser;
import com.example.gateway_bff.service.dto.AuthLoginResponse;
import com.example.gateway_bff.service.dto.AuthRefreshResponse;
import com.example.gateway_bff.service.dto.AuthTokenRequest;
import com.example.gateway_bff.service.dto.AuthVerifyResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * auth-service への呼び出し。
 *
 * <p>BFF はトークンを署名・検証しない。有効性の判断は常に auth-service の応答に従い、verify/refresh の 401 は
 * 「無効なトークン」として empty を返す。それ以外の失敗は {@link AuthIntegrationException} へ変換する。
 */
@Service
public class AuthServiceClient {

  private static final Logger logger = LoggerFactory.getLogger(AuthServiceClient.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient authRestClient;

  private final AuthServiceClientProperties properties;

  public AuthServiceClient(RestClient authRestClient, AuthServiceClientProperties properties) {
    this.authRestClient = authRestClient;
    this.properties = properties;
  }

  public String beginLogin() {
    final ResponseEntity<AuthLoginResponse> response =
        call(
            "beginLogin",
            () ->
                authRestClient
                    .get()
                    .uri(properties.loginPath())
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .toEntity(AuthLoginResponse.class));
    final AuthLoginResponse body = response.getBody();
    if (body == null || isBlank(body.authUrl())) {
      logger.warn("auth beginLogin response has no auth_url");
      throw new AuthIntegrationException(
          AuthIntegrationException.Reason.INVALID_RESPONSE, "auth response has no auth_url");
    }
    return body.authUrl();
  }

  public Optional<SessionUser> verify(String token) {
    if (isBlank(token)) {
      return Optional.empty();
    }
    final ResponseEntity<AuthVerifyResponse> response =
        call(
            "verify",
            () ->
                authRestClient
                    .post()
                    .uri(properties.verifyPath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new AuthTokenRequest(token))
                    .retrieve()
                    .onStatus(this::isUnauthorized, (request, res) -> {})
                    .toEntity(AuthVerifyResponse.class));
    if (isUnauthorized(response.getStatusCode())) {
      logger.debug("auth verify rejected token");
      return Optional.empty();
    }
    final AuthVerifyResponse body = response.getBody();
    if (body == null || !body.valid() || body.user() == null || isBlank(body.user().sub())) {
      logger.warn("auth verify response validation failed");
      throw new AuthIntegrationException(
          AuthIntegrationException.Reason.INVALID_RESPONSE, "auth verify response is invalid");
    }
    return Optional.of(body.user());
  }

  public Optional<String> refresh(String token) {
    if (isBlank(token)) {
      return Optional.empty();
    }
    final ResponseEntity<AuthRefreshResponse> response =
        call(
            "refresh",
            () ->
                authRestClient
                    .post()
                    .uri(properties.refreshPath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new AuthTokenRequest(token))
                    .retrieve()
                    .onStatus(this::isUnauthorized, (request, res) -> {})
                    .toEntity(AuthRefreshResponse.class));
    if (isUnauthorized(response.getStatusCode())) {
      logger.debug("auth refresh rejected token");
      return Optional.empty();
    }
    final AuthRefreshResponse body = response.getBody();
    if (body == null || isBlank(body.token())) {
      logger.warn("auth refresh response has no token");
      throw new AuthIntegrationException(
          AuthIntegrationException.Reason.INVALID_RESPONSE, "auth refresh response is invalid");
    }
    return Optional.of(body.token());
  }

  private <T> ResponseEntity<T> call(String operation, Supplier<ResponseEntity<T>> request) {
    try {
      return request.get();
    } catch (RestClientResponseException ex) {
      logger.warn(
          "auth {} failed with http status={} statusText={}",
          operation,
          ex.getStatusCode().value(),
          ex.getStatusText());
      if (ex.getStatusCode().value() == 401) {
        throw new AuthIntegrationException(
            AuthIntegrationException.Reason.UNAUTHORIZED, "auth rejected request", ex);
      }
      if (ex.getStatusCode().value() == 403) {
        throw new AuthIntegrationException(
            AuthIntegrationException.Reason.FORBIDDEN, "auth denied access", ex);
      }
      if (ex.getStatusCode().is5xxServerError()) {
        throw new AuthIntegrationException(
            AuthIntegrationException.Reason.BAD_GATEWAY, "auth server error", ex);
      }
      throw new AuthIntegrationException(
          AuthIntegrationException.Reason.BAD_GATEWAY, "auth request failed", ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("auth {} timed out", operation);
        throw new AuthIntegrationException(
            AuthIntegrationException.Reason.TIMEOUT, "auth request timeout", ex);
      }
      logger.warn("auth {} connection failed", operation, ex);
      throw new AuthIntegrationException(
          AuthIntegrationException.Reason.BAD_GATEWAY, "auth connection failed", ex);
    } catch (RuntimeException ex) {
      logger.warn("auth {} response parse failed", operation, ex);
      throw new AuthIntegrationException(
          AuthIntegrationException.Reason.INVALID_RESPONSE, "auth response parse failed", ex);
    }
  }

  private boolean isUnauthorized(HttpStatusCode status) {
    return status.value() == HttpStatus.UNAUTHORIZED.value();
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
