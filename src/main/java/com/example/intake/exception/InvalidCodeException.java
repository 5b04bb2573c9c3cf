package com.example.intake.exception;

/**
 * The identity provider rejected a one-time code. The challenge remains usable.
 */
public class InvalidCodeException extends RuntimeException {
  public InvalidCodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
