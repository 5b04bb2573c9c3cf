package com.example.intake.adapter.idp.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response of the magic-link and SMS send calls.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StytchSendResponse(
    @JsonProperty("request_id")
    String requestId,
    @JsonProperty("user_id")
    String userId,
    @JsonProperty("phone_id")
    String phoneId,
    @JsonProperty("user_created")
    Boolean userCreated
) {}
