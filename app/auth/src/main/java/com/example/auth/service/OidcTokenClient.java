package com.example.auth.service;

import com.example.auth.config.OidcProviderProperties;
import com.example.auth.model.RejectReason;
import com.example.auth.service.dto.TokenEndpointResponse;
import java.net.SocketTimeoutException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * 認可コードを IdP の token endpoint で id_token へ交換する。
 *
 * <p>認可コードは IdP 側で 1 回限りのため、失敗しても再試行しない。失敗はすべて EXCHANGE_FAILED として
 * 呼び出し側へ返し、IdP の応答本文はログにのみ残す。
 */
@Service
@RequiredArgsConstructor
public class OidcTokenClient {

  private static final Logger logger = LoggerFactory.getLogger(OidcTokenClient.class);

  private final RestClient idpRestClient;
  private final OidcProviderProperties properties;

  public String exchangeCode(String authorizationCode) {
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("code", authorizationCode);
    form.add("client_id", properties.clientId());
    form.add("client_secret", properties.clientSecret());
    form.add("redirect_uri", properties.redirectUri());
    form.add("grant_type", "authorization_code");

    final TokenEndpointResponse response;
    try {
      response =
          idpRestClient
              .post()
              .uri(properties.tokenUri())
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .accept(MediaType.APPLICATION_JSON)
              .body(form)
              .retrieve()
              .body(TokenEndpointResponse.class);
    } catch (RestClientResponseException ex) {
      logger.warn(
          "token exchange failed with http status={} body={}",
          ex.getStatusCode().value(),
          ex.getResponseBodyAsString());
      throw exchangeFailed("token endpoint returned an error", ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("token exchange timed out");
      } else {
        logger.warn("token exchange connection failed", ex);
      }
      throw exchangeFailed("token endpoint unreachable", ex);
    } catch (RestClientException ex) {
      logger.warn("token exchange response parse failed", ex);
      throw exchangeFailed("token endpoint response unreadable", ex);
    }

    if (response == null || response.idToken() == null || response.idToken().isBlank()) {
      logger.warn("token exchange response has no id_token");
      throw new LoginRejectedException(
          RejectReason.EXCHANGE_FAILED, "token endpoint response has no id_token");
    }
    return response.idToken();
  }

  private LoginRejectedException exchangeFailed(String message, Throwable cause) {
    return new LoginRejectedException(RejectReason.EXCHANGE_FAILED, message, cause);
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
