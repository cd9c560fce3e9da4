/*
 * どこで: libs/common/src/main/java/com/example/common/security/UserRole.java
 * 何を: セッショントークンに埋め込むロールを表す列挙型
 * なぜ: 未知のロール値を常に最小権限として扱うため
 */
package com.example.common.security;

public enum UserRole {
  USER("user"),
  ADMIN("admin");

  private final String value;

  UserRole(String value) {
    this.value = value;
  }

  /** トークン claim に書き込む文字列表現。 */
  public String value() {
    return value;
  }

  /**
   * claim の文字列をロールへ変換する。
   *
   * <p>完全一致した "admin" のみ ADMIN。それ以外(未知の値・null を含む)は USER。
   */
  public static UserRole fromValue(String value) {
    return ADMIN.value.equals(value) ? ADMIN : USER;
  }
}
