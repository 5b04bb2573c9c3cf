package com.example.intake.domain.entity;

/**
 * Where a browser stands in the two-factor flow, as far as its cookies tell.
 * A magic link that was sent but not yet opened leaves no trace on the browser, so that
 * client still reads as {@link #ANONYMOUS}.
 */
public enum AuthState {
  ANONYMOUS,
  PRIMARY_AUTHENTICATED,
  OTP_SENT,
  STEP_UP_COMPLETE
}
