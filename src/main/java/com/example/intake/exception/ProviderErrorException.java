package com.example.intake.exception;

/**
 * Identity provider failure as reported to the client. The message is safe to return in a
 * response body; the provider's own error stays in the cause.
 */
public class ProviderErrorException extends RuntimeException {
  public ProviderErrorException(String clientMessage, Throwable cause) {
    super(clientMessage, cause);
  }
}
