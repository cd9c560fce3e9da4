package com.example.gateway_bff.api;

import com.example.gateway_bff.model.GatewaySession;
import com.example.gateway_bff.service.ResourceServiceClient;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * セッションのトークンを付けて resource-service へ中継する。
 *
 * <p>ロール判定は行わない。resource-service の 401/403 はそのまま返す。
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ResourceProxyController {

  private final ResourceServiceClient resourceServiceClient;

  @GetMapping("/user/resources")
  public ResponseEntity<JsonNode> userResources(@AuthenticationPrincipal GatewaySession session) {
    return resourceServiceClient.get("/resources/user", session.token());
  }

  @GetMapping("/admin/resources")
  public ResponseEntity<JsonNode> adminResources(@AuthenticationPrincipal GatewaySession session) {
    return resourceServiceClient.get("/resources/admin", session.token());
  }

  @GetMapping("/resources/all")
  public ResponseEntity<JsonNode> allResources(@AuthenticationPrincipal GatewaySession session) {
    return resourceServiceClient.get("/resources/all", session.token());
  }

  @GetMapping("/user/profile")
  public ResponseEntity<JsonNode> userProfile(@AuthenticationPrincipal GatewaySession session) {
    return resourceServiceClient.get("/user/profile", session.token());
  }

  @GetMapping("/admin/stats")
  public ResponseEntity<JsonNode> adminStats(@AuthenticationPrincipal GatewaySession session) {
    return resourceServiceClient.get("/admin/stats", session.token());
  }

  @GetMapping("/admin/users")
  public ResponseEntity<JsonNode> adminUsers(@AuthenticationPrincipal GatewaySession session) {
    return resourceServiceClient.get("/admin/users", session.token());
  }
}
