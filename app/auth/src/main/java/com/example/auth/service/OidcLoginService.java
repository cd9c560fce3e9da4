package com.example.auth.service;

import com.example.auth.config.OidcProviderProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

@Service
@RequiredArgsConstructor
public class OidcLoginService {

  private final OidcProviderProperties properties;
  private final LoginStateService loginStateService;

  /** state を 1 件発行し、IdP の認可 URL を組み立てる。 */
  public String beginLogin() {
    final String state = loginStateService.issue();
    return UriComponentsBuilder.fromUriString(properties.authorizationUri())
        .queryParam("response_type", "code")
        .queryParam("client_id", properties.clientId())
        .queryParam("redirect_uri", properties.redirectUri())
        .queryParam("scope", properties.scope())
        .queryParam("state", state)
        .queryParam("access_type", "offline")
        .queryParam("prompt", "consent")
        .encode()
        .build()
        .toUriString();
  }
}
