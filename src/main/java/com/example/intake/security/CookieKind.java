package com.example.intake.security;

import java.time.Duration;

/**
 * Every cookie the flow writes, with its fixed scope and lifetime.
 * All of them are HTTP-only and site-wide.
 */
public enum CookieKind {
  PRIMARY_SESSION("intake_session", Duration.ofMinutes(60)),
  PHONE_CHALLENGE("intake_phone_challenge", Duration.ofMinutes(15)),
  STEP_UP("intake_mfa", Duration.ofMinutes(60));

  public static final String PATH = "/";

  private final String cookieName;
  private final Duration maxAge;

  CookieKind(String cookieName, Duration maxAge) {
    this.cookieName = cookieName;
    this.maxAge = maxAge;
  }

  public String cookieName() {
    return cookieName;
  }

  public Duration maxAge() {
    return maxAge;
  }
}
