package com.example.intake.adapter.idp.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned by the identity provider on non-2xx responses.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StytchErrorResponse(
    @JsonProperty("status_code")
    Integer statusCode,
    @JsonProperty("request_id")
    String requestId,
    @JsonProperty("error_type")
    String errorType,
    @JsonProperty("error_message")
    String errorMessage
) {}
