/*
 * どこで: app/resource/src/main/java/com/example/resource/api/ResourceController.java
 * 何を: 利用者向け・管理者向けの資源一覧 API を提供
 * なぜ: 経路ごとの要求ロールを Security 設定で判定した後、業務処理だけを行うため
 */
package com.example.resource.api;

import com.example.common.token.SessionClaims;
import com.example.resource.api.response.ApiEnvelope;
import com.example.resource.api.response.ResourceItemResponse;
import com.example.resource.service.ResourceService;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/resources")
@RequiredArgsConstructor
public class ResourceController {

  private final ResourceService resourceService;
  private final Clock clock;

  @GetMapping("/user")
  public ResponseEntity<ApiEnvelope<List<ResourceItemResponse>>> userResources(
      @AuthenticationPrincipal SessionClaims claims) {
    final List<ResourceItemResponse> items = resourceService.userResources(claims);
    return ok(items, "Retrieved " + items.size() + " user resources");
  }

  // ADMIN 以外はフィルタ層で 403 になる
  @GetMapping("/admin")
  public ResponseEntity<ApiEnvelope<List<ResourceItemResponse>>> adminResources(
      @AuthenticationPrincipal SessionClaims claims) {
    final List<ResourceItemResponse> items = resourceService.adminResources(claims);
    return ok(items, "Retrieved " + items.size() + " admin resources");
  }

  @GetMapping("/all")
  public ResponseEntity<ApiEnvelope<List<ResourceItemResponse>>> allResources(
      @AuthenticationPrincipal SessionClaims claims) {
    final List<ResourceItemResponse> items = resourceService.accessibleResources(claims);
    return ok(items, "Retrieved " + items.size() + " accessible resources");
  }

  private <T> ResponseEntity<ApiEnvelope<T>> ok(T data, String message) {
    return ResponseEntity.ok(ApiEnvelope.success(data, message, clock.instant()));
  }
}
