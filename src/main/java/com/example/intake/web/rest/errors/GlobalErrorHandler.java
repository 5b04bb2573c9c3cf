package com.example.intake.web.rest.errors;

import com.example.intake.exception.*;
import com.example.intake.web.rest.dto.FlowResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Global Error Handler
 *
 * Every failure of a programmatic flow step becomes {@code {ok:false, error}}. Messages come
 * from this service's own exceptions; provider errors and stack traces never reach the body.
 */
@Slf4j
@RestControllerAdvice
@RequestMapping(produces = MediaType.APPLICATION_JSON_VALUE)
public class GlobalErrorHandler {

  private static final String GENERIC_ERROR = "An error occurred processing your request";

  @ExceptionHandler(InvalidInputException.class)
  public ResponseEntity<FlowResponse> handleInvalidInput(InvalidInputException ex) {
    log.debug("Invalid input: {}", ex.getMessage());
    return failure(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(ChallengeExpiredException.class)
  public ResponseEntity<FlowResponse> handleChallengeExpired(ChallengeExpiredException ex) {
    log.debug("No active phone challenge");
    return failure(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(NoActiveSessionException.class)
  public ResponseEntity<FlowResponse> handleNoActiveSession(NoActiveSessionException ex) {
    log.debug("No active primary session");
    return failure(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(InvalidCodeException.class)
  public ResponseEntity<FlowResponse> handleInvalidCode(InvalidCodeException ex) {
    return failure(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(ProviderErrorException.class)
  public ResponseEntity<FlowResponse> handleProviderError(ProviderErrorException ex) {
    // already logged with its cause where it was raised
    return failure(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
  }

  @ExceptionHandler(IdentityProviderException.class)
  public ResponseEntity<FlowResponse> handleIdentityProviderException(IdentityProviderException ex) {
    log.error("Identity provider error", ex);
    return failure(HttpStatus.INTERNAL_SERVER_ERROR, "Identity service unavailable");
  }

  @ExceptionHandler(CredentialSigningException.class)
  public ResponseEntity<FlowResponse> handleCredentialSigning(CredentialSigningException ex) {
    log.error("Step-up credential error", ex);
    return failure(HttpStatus.INTERNAL_SERVER_ERROR, GENERIC_ERROR);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<FlowResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    log.debug("Unreadable request body: {}", ex.getMessage());
    return failure(HttpStatus.BAD_REQUEST, "Invalid request body");
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<FlowResponse> handleMediaType(HttpMediaTypeNotSupportedException ex) {
    return failure(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Unsupported content type");
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<FlowResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
    return failure(HttpStatus.METHOD_NOT_ALLOWED,
                   String.format("Method %s not supported", ex.getMethod()));
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<FlowResponse> handleNotFound(NoResourceFoundException ex) {
    return failure(HttpStatus.NOT_FOUND, "Not found");
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<FlowResponse> handleGenericException(Exception ex) {
    log.error("Unexpected error", ex);
    return failure(HttpStatus.INTERNAL_SERVER_ERROR, GENERIC_ERROR);
  }

  private ResponseEntity<FlowResponse> failure(HttpStatus status, String error) {
    return ResponseEntity.status(status)
        .contentType(MediaType.APPLICATION_JSON)
        .body(FlowResponse.failure(error));
  }
}
