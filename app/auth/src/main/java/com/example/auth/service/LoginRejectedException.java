package com.example.auth.service;

import com.example.auth.model.RejectReason;

public class LoginRejectedException extends RuntimeException {

  private final RejectReason reason;

  public LoginRejectedException(RejectReason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public LoginRejectedException(RejectReason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public RejectReason reason() {
    return reason;
  }
}
