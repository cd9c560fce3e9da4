package com.example.common.security;

// 操作ごとに要求されるロール
public enum RequiredRole {
  ANY_AUTHENTICATED,
  ADMIN
}
