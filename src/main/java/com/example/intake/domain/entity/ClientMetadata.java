package com.example.intake.domain.entity;

/**
 * Request details recorded with lead events. Every field is optional.
 */
public record ClientMetadata(
    String clientIp,
    String userAgent,
    String referrer
) {}
