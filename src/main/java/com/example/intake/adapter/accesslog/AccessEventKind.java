package com.example.intake.adapter.accesslog;

import java.util.Optional;

/**
 * Lead events. Only access requests are forwarded to the lead back end; the others are
 * kept in the application log.
 */
public enum AccessEventKind {
  ACCESS_REQUESTED("log/access"),
  OTP_REQUESTED(null),
  STEP_UP_COMPLETED(null);

  private final String remotePath;

  AccessEventKind(String remotePath) {
    this.remotePath = remotePath;
  }

  public Optional<String> remotePath() {
    return Optional.ofNullable(remotePath);
  }
}
