package com.example.resource.service;

import com.example.common.security.AccessPolicy;
import com.example.common.security.RequiredRole;
import com.example.common.token.SessionClaims;
import com.example.resource.api.response.ManagedUserResponse;
import com.example.resource.api.response.ResourceItemResponse;
import com.example.resource.api.response.SystemStatsResponse;
import com.example.resource.api.response.UserProfileResponse;
import com.example.resource.model.ResourceItem;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * 検証済み claims に応じて資源ビューを組み立てる。
 *
 * <p>経路単位の拒否は Security 設定側で済んでいる前提。ここでは /resources/all のように同じ経路で見える範囲が
 * ロールで変わるものだけを AccessPolicy で判定する。
 */
@Service
public class ResourceService {

  private static final String LEVEL_USER = "user";
  private static final String LEVEL_ADMIN = "admin";

  private final ResourceCatalog catalog;
  private final AccessPolicy accessPolicy;
  private final Clock clock;
  private final Instant startedAt;

  public ResourceService(ResourceCatalog catalog, AccessPolicy accessPolicy, Clock clock) {
    this.catalog = catalog;
    this.accessPolicy = accessPolicy;
    this.clock = clock;
    this.startedAt = clock.instant();
  }

  public List<ResourceItemResponse> userResources(SessionClaims claims) {
    return annotate(catalog.userDocuments(), LEVEL_USER, claims);
  }

  public List<ResourceItemResponse> adminResources(SessionClaims claims) {
    return annotate(catalog.adminResources(), LEVEL_ADMIN, claims);
  }

  public List<ResourceItemResponse> accessibleResources(SessionClaims claims) {
    final List<ResourceItem> visible = new ArrayList<>(catalog.userDocuments());
    if (isAdmin(claims)) {
      visible.addAll(catalog.adminResources());
    }
    return visible.stream()
        .map(
            item ->
                ResourceItemResponse.of(
                    item, item.sensitive() ? LEVEL_ADMIN : LEVEL_USER, claims.email()))
        .toList();
  }

  public UserProfileResponse profile(SessionClaims claims) {
    final boolean admin = isAdmin(claims);
    final int userCount = catalog.userDocuments().size();
    final int adminCount = admin ? catalog.adminResources().size() : 0;
    final String picture = claims.identity().avatarUrl();
    return new UserProfileResponse(
        new UserProfileResponse.UserInfo(
            claims.subjectId(),
            claims.email(),
            claims.identity().displayName(),
            picture == null ? "" : picture,
            claims.role()),
        new UserProfileResponse.Stats(
            userCount + adminCount, userCount, adminCount, claims.role(), clock.instant()),
        new UserProfileResponse.Permissions(true, admin, admin));
  }

  public SystemStatsResponse systemStats() {
    final int userCount = catalog.userDocuments().size();
    final int adminCount = catalog.adminResources().size();
    final Instant now = clock.instant();
    final Duration uptime = Duration.between(startedAt, now);
    return new SystemStatsResponse(
        userCount + adminCount,
        userCount,
        adminCount,
        formatUptime(uptime),
        uptime.getSeconds(),
        now);
  }

  public List<ManagedUserResponse> managedUsers() {
    return catalog.managedUsers().stream().map(ManagedUserResponse::from).toList();
  }

  private boolean isAdmin(SessionClaims claims) {
    return accessPolicy.authorize(claims.identity(), RequiredRole.ADMIN);
  }

  private List<ResourceItemResponse> annotate(
      List<ResourceItem> items, String accessLevel, SessionClaims claims) {
    return items.stream()
        .map(item -> ResourceItemResponse.of(item, accessLevel, claims.email()))
        .toList();
  }

  static String formatUptime(Duration uptime) {
    return String.format(
        "%d days, %d hours, %d minutes",
        uptime.toDays(), uptime.toHoursPart(), uptime.toMinutesPart());
  }
}
