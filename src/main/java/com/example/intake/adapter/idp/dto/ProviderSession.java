package com.example.intake.adapter.idp.dto;

/**
 * Canonical session issued by the identity provider after a factor succeeds.
 *
 * @param sessionToken opaque primary session token
 * @param subjectId    provider user identifier
 */
public record ProviderSession(String sessionToken, String subjectId) {

  @Override
  public String toString() {
    return "ProviderSession[sessionToken=***, subjectId=" + subjectId + "]";
  }
}
