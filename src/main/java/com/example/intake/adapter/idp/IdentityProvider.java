package com.example.intake.adapter.idp;

import com.example.intake.adapter.idp.dto.ProviderSession;
import com.example.intake.adapter.idp.dto.ProviderUser;

import java.util.Optional;

/**
 * Behavioral contract of the identity provider: magic links, SMS one-time codes and sessions.
 * Implementations normalize the provider's response shapes into the canonical records here and
 * translate every failure into an {@link com.example.intake.exception.IdentityProviderException}.
 */
public interface IdentityProvider {

  /**
   * Sends a login-or-signup magic link to the given email.
   *
   * @return the provider's request identifier, or null when the provider sent none
   */
  String sendMagicLink(String email, String loginRedirectUrl, String signupRedirectUrl);

  /**
   * Exchanges the token carried by a magic link for a primary session.
   */
  ProviderSession authenticateMagicLink(String token, int sessionTtlMinutes);

  /**
   * Sends a one-time code by SMS. When an existing session token is supplied the phone is attached
   * to that user; otherwise the provider logs in or creates a user by phone.
   *
   * @return the challenge identifier the code must be authenticated against
   */
  String sendOtp(String phoneE164, Optional<String> existingSessionToken);

  /**
   * Authenticates a one-time code against its challenge.
   */
  ProviderSession authenticateOtp(String challengeId, String code,
                                  Optional<String> existingSessionToken, int sessionTtlMinutes);

  /**
   * Validates a primary session token.
   *
   * @return the subject the session belongs to
   */
  String authenticateSession(String sessionToken);

  /**
   * Loads the contact details of a subject.
   */
  ProviderUser getUser(String subjectId);
}
