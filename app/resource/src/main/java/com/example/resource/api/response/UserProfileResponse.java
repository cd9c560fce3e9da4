package com.example.resource.api.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record UserProfileResponse(
    @JsonProperty("user_info") UserInfo userInfo, Stats stats, Permissions permissions) {

  public record UserInfo(String sub, String email, String name, String picture, String role) {}

  public record Stats(
      @JsonProperty("total_accessible_resources") int totalAccessibleResources,
      @JsonProperty("user_resources") int userResources,
      @JsonProperty("admin_resources") int adminResources,
      String role,
      @JsonProperty("last_accessed") Instant lastAccessed) {}

  public record Permissions(
      @JsonProperty("can_access_user_resources") boolean canAccessUserResources,
      @JsonProperty("can_access_admin_resources") boolean canAccessAdminResources,
      @JsonProperty("can_manage_users") boolean canManageUsers) {}
}
