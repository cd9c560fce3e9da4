/*
 * どこで: app/resource/src/main/java/com/example/resource/service/ResourceCatalog.java
 * 何を: 一般利用者向け・管理者向けのサンプル資源と管理対象ユーザー一覧を保持する
 * なぜ: 永続化を持たない構成でもアクセス制御の結果を確認できるようにするため
 */
package com.example.resource.service;

import com.example.resource.model.ManagedUser;
import com.example.resource.model.ResourceItem;
import java.time.Instant;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class ResourceCatalog {

  private final List<ResourceItem> userDocuments =
      List.of(
          new ResourceItem(
              1,
              "Personal Document 1",
              "This is a user-accessible document.",
              "document",
              Instant.parse("2025-01-01T10:00:00Z"),
              false),
          new ResourceItem(
              2,
              "User Report",
              "Monthly user activity report.",
              "report",
              Instant.parse("2025-01-15T14:30:00Z"),
              false),
          new ResourceItem(
              3,
              "Project Files",
              "Access to your project files and documents.",
              "files",
              Instant.parse("2025-01-20T09:15:00Z"),
              false));

  private final List<ResourceItem> adminResources =
      List.of(
          new ResourceItem(
              101,
              "System Configuration",
              "Critical system settings and configurations.",
              "config",
              Instant.parse("2025-01-01T09:00:00Z"),
              true),
          new ResourceItem(
              102,
              "User Management Dashboard",
              "Comprehensive user analytics and management tools.",
              "dashboard",
              Instant.parse("2025-01-10T11:00:00Z"),
              true),
          new ResourceItem(
              103,
              "System Logs",
              "Access to system logs and audit trails.",
              "logs",
              Instant.parse("2025-01-25T16:45:00Z"),
              true));

  private final List<ManagedUser> managedUsers =
      List.of(
          new ManagedUser(
              1,
              "user1@example.com",
              "Regular User",
              "user",
              Instant.parse("2025-01-30T10:30:00Z"),
              "active"),
          new ManagedUser(
              2,
              "admin@example.com",
              "Admin User",
              "admin",
              Instant.parse("2025-01-31T08:15:00Z"),
              "active"),
          new ManagedUser(
              3,
              "user2@example.com",
              "Another User",
              "user",
              Instant.parse("2025-01-29T14:45:00Z"),
              "active"));

  public List<ResourceItem> userDocuments() {
    return userDocuments;
  }

  public List<ResourceItem> adminResources() {
    return adminResources;
  }

  public List<ManagedUser> managedUsers() {
    return managedUsers;
  }
}
