package com.example.auth.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.auth.config.OidcProviderProperties;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

class OidcLoginServiceTest {

  private final LoginStateService loginStateService =
      new LoginStateService(
          new InMemoryLoginStateStore(),
          new MutableClock(Instant.parse("2025-01-01T00:00:00Z")),
          Duration.ofMinutes(10));

  private final OidcLoginService service =
      new OidcLoginService(
          new OidcProviderProperties(
              "client-1",
              "secret-1",
              "http://localhost:5001/auth/callback",
              null,
              null,
              null,
              null,
              null,
              null,
              null,
              null),
          loginStateService);

  @Test
  void beginLoginBuildsAuthorizationUrlWithFreshState() {
    final String url = service.beginLogin();

    final UriComponents components = UriComponentsBuilder.fromUriString(url).build();
    final MultiValueMap<String, String> query = components.getQueryParams();
    assertThat(url).startsWith("https://accounts.google.com/o/oauth2/auth?");
    assertThat(query.getFirst("response_type")).isEqualTo("code");
    assertThat(query.getFirst("client_id")).isEqualTo("client-1");
    assertThat(query.getFirst("redirect_uri"))
        .isEqualTo("http://localhost:5001/auth/callback");
    assertThat(query.getFirst("scope")).isEqualTo("openid%20email%20profile");
    assertThat(query.getFirst("access_type")).isEqualTo("offline");
    assertThat(query.getFirst("prompt")).isEqualTo("consent");

    final String state = query.getFirst("state");
    assertThat(state).hasSize(64);
    assertThat(loginStateService.consume(state)).isTrue();
  }

  @Test
  void eachLoginIssuesItsOwnState() {
    final String first =
        UriComponentsBuilder.fromUriString(service.beginLogin())
            .build()
            .getQueryParams()
            .getFirst("state");
    final String second =
        UriComponentsBuilder.fromUriString(service.beginLogin())
            .build()
            .getQueryParams()
            .getFirst("state");

    assertThat(first).isNotEqualTo(second);
    assertThat(loginStateService.outstandingCount()).isEqualTo(2);
  }
}
