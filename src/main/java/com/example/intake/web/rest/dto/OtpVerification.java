package com.example.intake.web.rest.dto;

public record OtpVerification(String code) {

  @Override
  public String toString() {
    return "OtpVerification[code=***]";
  }
}
