package com.example.intake.domain.entity;

import java.time.Instant;

/**
 * Verified content of a step-up credential.
 */
public record StepUpClaims(
    String subjectId,
    boolean secondFactorSatisfied,
    Instant issuedAt,
    Instant expiresAt
) {}
