package com.example.intake.exception;

/**
 * Primary session required but absent
 */
public class NoActiveSessionException extends RuntimeException {
  public NoActiveSessionException(String message) {
    super(message);
  }

  public NoActiveSessionException(String message, Throwable cause) {
    super(message, cause);
  }
}
