package com.example.intake.exception;

/**
 * No phone challenge cookie on the request; the code has to be resent
 */
public class ChallengeExpiredException extends RuntimeException {
  public ChallengeExpiredException(String message) {
    super(message);
  }

  public ChallengeExpiredException(String message, Throwable cause) {
    super(message, cause);
  }
}
