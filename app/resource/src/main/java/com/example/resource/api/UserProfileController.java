package com.example.resource.api;

import com.example.common.token.SessionClaims;
import com.example.resource.api.response.ApiEnvelope;
import com.example.resource.api.response.UserProfileResponse;
import com.example.resource.service.ResourceService;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class UserProfileController {

  private final ResourceService resourceService;
  private final Clock clock;

  @GetMapping("/user/profile")
  public ResponseEntity<ApiEnvelope<UserProfileResponse>> profile(
      @AuthenticationPrincipal SessionClaims claims) {
    return ResponseEntity.ok(
        ApiEnvelope.success(
            resourceService.profile(claims), "Profile retrieved successfully", clock.instant()));
  }
}
