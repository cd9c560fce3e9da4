/*
 * どこで: app/resource/src/main/java/com/example/resource/api/AdminController.java
 * 何を: 管理者向けの統計・ユーザー一覧 API を提供
 * なぜ: 高権限の参照を /admin 配下に分離し、経路単位で ADMIN を要求するため
 */
package com.example.resource.api;

import com.example.resource.api.response.ApiEnvelope;
import com.example.resource.api.response.ManagedUserResponse;
import com.example.resource.api.response.SystemStatsResponse;
import com.example.resource.service.ResourceService;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class AdminController {

  private final ResourceService resourceService;
  private final Clock clock;

  @GetMapping("/stats")
  public ResponseEntity<ApiEnvelope<SystemStatsResponse>> stats() {
    return ResponseEntity.ok(
        ApiEnvelope.success(
            resourceService.systemStats(), "System statistics retrieved", clock.instant()));
  }

  @GetMapping("/users")
  public ResponseEntity<ApiEnvelope<List<ManagedUserResponse>>> users() {
    return ResponseEntity.ok(
        ApiEnvelope.success(
            resourceService.managedUsers(), "User list retrieved successfully", clock.instant()));
  }
}
