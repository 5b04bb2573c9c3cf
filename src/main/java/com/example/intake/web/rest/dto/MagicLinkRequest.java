package com.example.intake.web.rest.dto;

/**
 * Entry form submission. Phone and referrer are optional lead details.
 */
public record MagicLinkRequest(String email, String phone, String referrer) {}
