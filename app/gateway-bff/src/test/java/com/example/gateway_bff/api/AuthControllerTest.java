package com.example.gateway_bff.api;

import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.gateway_bff.config.SessionConfig;
import com.example.gateway_bff.model.SessionUser;
import com.example.gateway_bff.service.AuthIntegrationException;
import com.example.gateway_bff.service.AuthServiceClient;
import com.example.gateway_bff.service.GatewayMetrics;
import com.example.gateway_bff.service.SessionCookieManager;
import com.example.gateway_bff.service.SessionService;
import com.example.gateway_bff.service.SessionVerificationService;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AuthController.class)
@AutoConfigureMockMvc(addFilters = false)
@ActiveProfiles("test")
@Import({
  GatewayApiExceptionHandler.class,
  SessionConfig.class,
  SessionService.class,
  SessionCookieManager.class
})
class AuthControllerTest {

  private static final SessionUser USER =
      new SessionUser("google-sub-1", "user@example.com", "User", "user", "");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private AuthServiceClient authServiceClient;
  @MockitoBean private SessionVerificationService sessionVerificationService;
  @MockitoBean private GatewayMetrics gatewayMetrics;

  @Test
  void homeRedirectsToLoginWithoutSession() throws Exception {
    mockMvc
        .perform(get("/"))
        .andExpect(status().isFound())
        .andExpect(header().string("Location", "/login"));
  }

  @Test
  void loginWithoutErrorReportsUnauthenticated() throws Exception {
    mockMvc
        .perform(get("/login"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.authenticated").value(false))
        .andExpect(jsonPath("$.error").doesNotExist());
  }

  @Test
  void loginMapsKnownErrorToMessage() throws Exception {
    mockMvc
        .perform(get("/login").param("error", "state_mismatch"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.error").value("state_mismatch"))
        .andExpect(
            jsonPath("$.message")
                .value("Authentication failed due to security check. Please try again."));
  }

  @Test
  void loginMapsUnknownErrorToEmptyMessage() throws Exception {
    mockMvc
        .perform(get("/login").param("error", "something_else"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").value(""));
  }

  @Test
  void initiateRedirectsToAuthUrl() throws Exception {
    when(authServiceClient.beginLogin())
        .thenReturn("https://accounts.google.com/o/oauth2/v2/auth?state=abc");

    mockMvc
        .perform(get("/auth/initiate"))
        .andExpect(status().isFound())
        .andExpect(
            header().string("Location", "https://accounts.google.com/o/oauth2/v2/auth?state=abc"));
  }

  @Test
  void initiateRedirectsToLoginWhenAuthIsDown() throws Exception {
    when(authServiceClient.beginLogin())
        .thenThrow(
            new AuthIntegrationException(AuthIntegrationException.Reason.BAD_GATEWAY, "down"));

    mockMvc
        .perform(get("/auth/initiate"))
        .andExpect(status().isFound())
        .andExpect(header().string("Location", "/login?error=auth_service_error"));
    verify(gatewayMetrics).recordLoginResult("auth_service_error");
  }

  @Test
  void successWithoutTokenRedirectsWithNoToken() throws Exception {
    mockMvc
        .perform(get("/auth/success"))
        .andExpect(status().isFound())
        .andExpect(header().string("Location", "/login?error=no_token"));
    verify(authServiceClient, never()).verify(any());
  }

  @Test
  void successWithRejectedTokenRedirectsWithInvalidToken() throws Exception {
    when(authServiceClient.verify("forged")).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/auth/success").param("token", "forged"))
        .andExpect(status().isFound())
        .andExpect(header().string("Location", "/login?error=invalid_token"))
        .andExpect(header().doesNotExist("Set-Cookie"));
    verify(gatewayMetrics).recordLoginResult("invalid_token");
  }

  @Test
  void successWithAuthOutageRedirectsWithServiceError() throws Exception {
    when(authServiceClient.verify("session-token"))
        .thenThrow(new AuthIntegrationException(AuthIntegrationException.Reason.TIMEOUT, "slow"));

    mockMvc
        .perform(get("/auth/success").param("token", "session-token"))
        .andExpect(status().isFound())
        .andExpect(header().string("Location", "/login?error=auth_service_error"));
  }

  @Test
  void successCreatesSessionCookieAndRedirectsToMe() throws Exception {
    when(authServiceClient.verify("session-token")).thenReturn(Optional.of(USER));

    mockMvc
        .perform(get("/auth/success").param("token", "session-token"))
        .andExpect(status().isFound())
        .andExpect(header().string("Location", "/me"))
        .andExpect(
            header()
                .string(
                    "Set-Cookie",
                    allOf(
                        startsWith("MSS_SESSION="),
                        containsString("HttpOnly"),
                        containsString("SameSite=Lax"))));
    verify(gatewayMetrics).recordLoginResult("success");
  }
}
