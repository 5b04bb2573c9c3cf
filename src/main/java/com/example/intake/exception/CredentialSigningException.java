package com.example.intake.exception;

/**
 * Step-up credential could not be produced
 */
public class CredentialSigningException extends RuntimeException {
  public CredentialSigningException(String message) {
    super(message);
  }

  public CredentialSigningException(String message, Throwable cause) {
    super(message, cause);
  }
}
