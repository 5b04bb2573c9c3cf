package com.example.intake.adapter.idp.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response of the session authenticate call.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StytchSessionResponse(
    @JsonProperty("session")
    StytchAuthenticateResponse.StytchSession session
) {}
