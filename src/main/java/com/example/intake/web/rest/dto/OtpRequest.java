package com.example.intake.web.rest.dto;

/**
 * Phone number as typed by the user; normalized server-side.
 */
public record OtpRequest(String phone) {}
