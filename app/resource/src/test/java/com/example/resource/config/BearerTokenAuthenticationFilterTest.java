package com.example.resource.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.common.security.Identity;
import com.example.common.token.SessionTokenCodec;
import com.example.common.token.SessionTokenProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

class BearerTokenAuthenticationFilterTest {

  private static final String SECRET = "0123456789abcdef0123456789abcdef-filter";
  private static final Instant NOW = Instant.parse("2025-01-01T12:00:00Z");

  private final SessionTokenCodec codec =
      new SessionTokenCodec(
          new SessionTokenProperties(SECRET, Duration.ofHours(8)),
          Clock.fixed(NOW, ZoneOffset.UTC));
  private final BearerTokenAuthenticationFilter filter =
      new BearerTokenAuthenticationFilter(codec);

  @AfterEach
  void clearContext() {
    SecurityContextHolder.clearContext();
  }

  @Test
  void validBearerTokenEstablishesSessionAuthentication() throws Exception {
    final String token =
        codec.issue(new Identity("sub-1", "admin@example.com", "Admin", null, "admin"));
    final MockHttpServletRequest request = request("/resources/admin");
    request.addHeader("Authorization", "Bearer " + token);
    final MockFilterChain chain = new MockFilterChain();

    filter.doFilter(request, new MockHttpServletResponse(), chain);

    final Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    assertThat(authentication).isInstanceOf(SessionAuthentication.class);
    assertThat(authentication.getName()).isEqualTo("sub-1");
    assertThat(authentication.getAuthorities())
        .extracting(Object::toString)
        .containsExactly("ROLE_ADMIN");
    assertThat(authentication.getCredentials()).isNull();
    assertThat(chain.getRequest()).isNotNull();
  }

  @Test
  void missingHeaderContinuesWithoutAuthentication() throws Exception {
    final MockHttpServletRequest request = request("/resources/user");
    final MockFilterChain chain = new MockFilterChain();

    filter.doFilter(request, new MockHttpServletResponse(), chain);

    assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    assertThat(request.getAttribute(BearerTokenAuthenticationFilter.FAILURE_ATTRIBUTE))
        .isEqualTo(BearerTokenAuthenticationFilter.Failure.MISSING);
    assertThat(chain.getRequest()).isNotNull();
  }

  @Test
  void nonBearerSchemeIsTreatedAsMissing() throws Exception {
    final MockHttpServletRequest request = request("/resources/user");
    request.addHeader("Authorization", "Basic dXNlcjpwYXNz");

    filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

    assertThat(request.getAttribute(BearerTokenAuthenticationFilter.FAILURE_ATTRIBUTE))
        .isEqualTo(BearerTokenAuthenticationFilter.Failure.MISSING);
  }

  @Test
  void tokenSignedWithAnotherSecretIsInvalid() throws Exception {
    final SessionTokenCodec foreign =
        new SessionTokenCodec(
            new SessionTokenProperties("another-secret-0123456789abcdef0123", Duration.ofHours(8)),
            Clock.fixed(NOW, ZoneOffset.UTC));
    final MockHttpServletRequest request = request("/resources/user");
    request.addHeader(
        "Authorization",
        "Bearer " + foreign.issue(new Identity("sub-1", "a@example.com", "A", null, "admin")));

    filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

    assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    assertThat(request.getAttribute(BearerTokenAuthenticationFilter.FAILURE_ATTRIBUTE))
        .isEqualTo(BearerTokenAuthenticationFilter.Failure.INVALID);
  }

  @Test
  void publicPathsAreNotFiltered() throws Exception {
    final MockHttpServletRequest request = request("/health");
    request.addHeader("Authorization", "Bearer garbage");

    filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

    assertThat(request.getAttribute(BearerTokenAuthenticationFilter.FAILURE_ATTRIBUTE)).isNull();
  }

  private static MockHttpServletRequest request(String uri) {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", uri);
    request.setRequestURI(uri);
    return request;
  }
}
