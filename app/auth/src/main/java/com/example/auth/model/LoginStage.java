package com.example.auth.model;

// callback 処理の到達段階。失敗時にどこまで進んだかをログへ出す
public enum LoginStage {
  CALLBACK_RECEIVED,
  STATE_VALIDATED,
  CODE_EXCHANGED,
  IDENTITY_VERIFIED,
  TOKEN_ISSUED
}
