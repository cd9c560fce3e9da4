package com.example.auth.api;

import com.example.auth.api.response.AuthConfigResponse;
import com.example.auth.api.response.StateDebugResponse;
import com.example.auth.config.AuthProperties;
import com.example.auth.config.OidcProviderProperties;
import com.example.auth.service.LoginStateService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

// ローカル調査用。auth.diagnostics-enabled=true のときのみ登録する
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "auth", name = "diagnostics-enabled", havingValue = "true")
public class AuthDiagnosticsController {

  private final OidcProviderProperties oidcProperties;
  private final AuthProperties authProperties;
  private final LoginStateService loginStateService;

  @GetMapping("/config")
  public ResponseEntity<AuthConfigResponse> config() {
    return ResponseEntity.ok(
        new AuthConfigResponse(
            oidcProperties.clientId(),
            oidcProperties.redirectUri(),
            oidcProperties.authorizationUri(),
            oidcProperties.tokenUri(),
            oidcProperties.scope(),
            authProperties.frontendUrl()));
  }

  // state の値そのものは返さない
  @GetMapping("/debug")
  public ResponseEntity<StateDebugResponse> debug() {
    return ResponseEntity.ok(new StateDebugResponse(loginStateService.outstandingCount()));
  }
}
