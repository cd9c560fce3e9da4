package com.example.gateway_bff.service;

import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * resource-service へセッショントークンを Bearer で中継する。
 *
 * <p>4xx(401/403 を含む)は本文ごとそのまま返す。5xx・接続失敗・タイムアウトは
 * {@link ResourceIntegrationException} に変換する。
 */
@Service
public class ResourceServiceClient {

  private static final Logger logger = LoggerFactory.getLogger(ResourceServiceClient.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient resourceRestClient;

  public ResourceServiceClient(RestClient resourceRestClient) {
    this.resourceRestClient = resourceRestClient;
  }

  public ResponseEntity<JsonNode> get(String path, String token) {
    final ResponseEntity<JsonNode> response;
    try {
      response =
          resourceRestClient
              .get()
              .uri(path)
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .onStatus(HttpStatusCode::is4xxClientError, (request, res) -> {})
              .toEntity(JsonNode.class);
    } catch (RestClientResponseException ex) {
      logger.warn(
          "resource {} failed with http status={} statusText={}",
          path,
          ex.getStatusCode().value(),
          ex.getStatusText());
      throw new ResourceIntegrationException(
          ResourceIntegrationException.Reason.BAD_GATEWAY, "resource server error", ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("resource {} timed out", path);
        throw new ResourceIntegrationException(
            ResourceIntegrationException.Reason.TIMEOUT, "resource request timeout", ex);
      }
      logger.warn("resource {} connection failed", path, ex);
      throw new ResourceIntegrationException(
          ResourceIntegrationException.Reason.BAD_GATEWAY, "resource connection failed", ex);
    } catch (RuntimeException ex) {
      logger.warn("resource {} response parse failed", path, ex);
      throw new ResourceIntegrationException(
          ResourceIntegrationException.Reason.INVALID_RESPONSE, "resource response parse failed", ex);
    }
    if (response.getStatusCode().is4xxClientError()) {
      logger.info("resource {} answered status={}", path, response.getStatusCode().value());
    }
    // 下流のヘッダーは引き継がない
    return ResponseEntity.status(response.getStatusCode()).body(response.getBody());
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
