package com.example.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  // 上流から受け取った ID は長さと文字種を確認してから採用する
  public static String resolve(String candidate) {
    if (candidate == null || candidate.isBlank() || candidate.length() > 128) {
      return newTraceId();
    }
    for (int i = 0; i < candidate.length(); i++) {
      final char c = candidate.charAt(i);
      if (!(Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == '.')) {
        return newTraceId();
      }
    }
    return candidate;
  }
}
