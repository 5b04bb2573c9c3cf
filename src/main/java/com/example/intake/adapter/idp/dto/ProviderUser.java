package com.example.intake.adapter.idp.dto;

/**
 * Contact details of a provider user. Either field may be null.
 */
public record ProviderUser(String subjectId, String email, String phone) {}
