package com.example.intake.exception;

/**
 * Identity provider failure or timeout
 */
public class IdentityProviderException extends RuntimeException {
  public IdentityProviderException(String message) {
    super(message);
  }

  public IdentityProviderException(String message, Throwable cause) {
    super(message, cause);
  }
}
