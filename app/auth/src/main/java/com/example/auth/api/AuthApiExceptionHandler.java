/*
 * どこで: app/auth/src/main/java/com/example/auth/api/AuthApiExceptionHandler.java
 * 何を: Auth API の例外を標準エラー形式へ変換する
 * なぜ: 内部例外の詳細を呼び出し側へ出さず、失敗時の契約を一定に保つため
 */
package com.example.auth.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class AuthApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(AuthApiExceptionHandler.class);

  /**
   * 役割:
   * - 必須パラメータ欠落を 400 へマッピングする。
   *
   * 期待動作:
   * - 外部呼び出しより前に弾かれた入力不正のみがここに来る。
   */
  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("BAD_REQUEST", "request body is required"));
  }

  /**
   * 役割:
   * - 想定外の例外を 500 へマッピングする。
   *
   * 期待動作:
   * - スタックトレースはログにのみ出し、応答は固定メッセージにする。
   */
  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleUnexpected(RuntimeException ex) {
    logger.error("unexpected auth api failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("INTERNAL_ERROR", "internal error"));
  }
}
