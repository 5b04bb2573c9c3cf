package com.example.intake.exception;

/**
 * Provider reported success but returned neither a session token nor a session JWT.
 */
public class NoSessionIssuedException extends IdentityProviderException {
  public NoSessionIssuedException(String message) {
    super(message);
  }
}
