package com.example.intake.adapter.idp.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * User record, as returned by the get-user call and embedded in session responses.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StytchUserResponse(
    @JsonProperty("user_id")
    String userId,
    @JsonProperty("emails")
    List<Email> emails,
    @JsonProperty("phone_numbers")
    List<PhoneNumber> phoneNumbers
) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Email(
      @JsonProperty("email")
      String email,
      @JsonProperty("verified")
      Boolean verified
  ) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record PhoneNumber(
      @JsonProperty("phone_number")
      String phoneNumber,
      @JsonProperty("verified")
      Boolean verified
  ) {}
}
