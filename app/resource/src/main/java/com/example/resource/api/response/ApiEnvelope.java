package com.example.resource.api.response;

import java.time.Instant;

/** 資源 API 共通の応答形式。 */
public record ApiEnvelope<T>(String status, String message, T data, Instant timestamp) {

  public static <T> ApiEnvelope<T> success(T data, String message, Instant timestamp) {
    return new ApiEnvelope<>("success", message, data, timestamp);
  }
}
