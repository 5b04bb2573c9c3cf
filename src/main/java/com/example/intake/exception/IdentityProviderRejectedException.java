package com.example.intake.exception;

import lombok.Getter;

/**
 * Identity provider answered with a client error (unknown token, wrong code, replayed link).
 * Carries the provider's error type and its user-facing message, never the raw response.
 */
@Getter
public class IdentityProviderRejectedException extends IdentityProviderException {

  private final int statusCode;
  private final String errorType;
  private final String providerMessage;

  public IdentityProviderRejectedException(int statusCode, String errorType, String providerMessage) {
    super("Identity provider rejected the request, status: " + statusCode + ", type: " + errorType);
    this.statusCode = statusCode;
    this.errorType = errorType;
    this.providerMessage = providerMessage;
  }
}
