package com.example.intake.adapter.idp.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response of the magic-link and one-time-code authenticate calls.
 * Depending on the flow the session arrives as an opaque token, a JWT, or both.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StytchAuthenticateResponse(
    @JsonProperty("request_id")
    String requestId,
    @JsonProperty("user_id")
    String userId,
    @JsonProperty("session_token")
    String sessionToken,
    @JsonProperty("session_jwt")
    String sessionJwt,
    @JsonProperty("session")
    StytchSession session
) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record StytchSession(
      @JsonProperty("session_id")
      String sessionId,
      @JsonProperty("user_id")
      String userId
  ) {}
}
