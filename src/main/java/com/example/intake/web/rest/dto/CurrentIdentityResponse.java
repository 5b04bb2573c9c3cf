package com.example.intake.web.rest.dto;

/**
 * Identity behind a completed step-up. Email and phone are null when the provider cannot
 * confirm the primary session.
 */
public record CurrentIdentityResponse(String subjectId, String email, String phone) {}
