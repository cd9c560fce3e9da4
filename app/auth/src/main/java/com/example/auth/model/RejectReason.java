package com.example.auth.model;

/** ログイン試行の失敗理由。redirectCode はフロントエンドへ返す error クエリの値。 */
public enum RejectReason {
  STATE_MISMATCH("state_mismatch"),
  MISSING_CODE("no_code"),
  EXCHANGE_FAILED("token_exchange_failed"),
  INVALID_IDENTITY("invalid_token"),
  INTERNAL_ERROR("internal_error");

  private final String redirectCode;

  RejectReason(String redirectCode) {
    this.redirectCode = redirectCode;
  }

  public String redirectCode() {
    return redirectCode;
  }
}
