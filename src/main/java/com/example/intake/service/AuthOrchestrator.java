package com.example.intake.service;

import com.example.intake.adapter.accesslog.AccessEventKind;
import com.example.intake.adapter.accesslog.AccessLog;
import com.example.intake.adapter.idp.IdentityProvider;
import com.example.intake.adapter.idp.dto.ProviderSession;
import com.example.intake.domain.entity.AuthState;
import com.example.intake.domain.entity.ClientMetadata;
import com.example.intake.domain.entity.StepUpClaims;
import com.example.intake.exception.*;
import com.example.intake.properties.ApplicationProperties;
import com.example.intake.security.CookieKind;
import com.example.intake.security.CookieStore;
import com.example.intake.security.StepUpCredentialSigner;
import com.example.intake.util.EmailAddresses;
import com.example.intake.util.LogMasking;
import com.example.intake.util.PhoneNumbers;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Drives a browser through the two-factor flow:
 * ANONYMOUS, magic link sent, PRIMARY_AUTHENTICATED, OTP_SENT, STEP_UP_COMPLETE.
 * <p>
 * No state is kept here. Each transition reads the browser's cookies, calls the identity
 * provider, and writes cookies only once the provider call has succeeded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthOrchestrator {

  public static final String LINK_CONSUME_PATH = "/auth/link/consume";
  public static final String REASON_MISSING_TOKEN = "missing-token";
  public static final String REASON_AUTH_FAILED = "auth-failed";

  private static final Pattern NUMERIC_CODE = Pattern.compile("^\\d{4,10}$");
  private static final String MAGIC_LINK_FAILED = "Failed to send magic link";

  private final IdentityProvider identityProvider;
  private final CookieStore cookieStore;
  private final StepUpCredentialSigner credentialSigner;
  private final AccessLog accessLog;
  private final ApplicationProperties properties;

  /**
   * Starts the primary factor. Touches no cookie.
   *
   * @return the provider's request identifier
   */
  public String requestMagicLink(String email, String phone, ClientMetadata client) {
    if (!EmailAddresses.isValid(email)) {
      throw new InvalidInputException("Invalid email");
    }

    String linkUrl = linkConsumeUrl();
    String requestId;
    try {
      requestId = identityProvider.sendMagicLink(email, linkUrl, linkUrl);
    } catch (IdentityProviderRejectedException e) {
      log.warn("Magic link request for {} rejected: {}", LogMasking.maskEmail(email), e.getErrorType());
      String message = e.getProviderMessage() != null ? e.getProviderMessage() : MAGIC_LINK_FAILED;
      throw new ProviderErrorException(message, e);
    } catch (IdentityProviderException e) {
      log.error("Magic link request for {} failed", LogMasking.maskEmail(email), e);
      throw new ProviderErrorException(MAGIC_LINK_FAILED, e);
    }

    log.info("Magic link sent to {}, requestId={}", LogMasking.maskEmail(email), requestId);
    accessLog.record(AccessEventKind.ACCESS_REQUESTED, leadFields(email, phone, client));
    return requestId;
  }

  /**
   * Finishes the primary factor.
   *
   * @return where to send the browser: the second-factor page on success, the entry point with
   *     a reason code otherwise
   */
  public URI consumeMagicLink(String token, HttpServletResponse response) {
    if (token == null || token.isBlank()) {
      log.debug("Magic link consumed without a token");
      return entryPoint(REASON_MISSING_TOKEN);
    }

    ProviderSession session;
    try {
      session = identityProvider.authenticateMagicLink(token,
                                                       properties.identityProvider().sessionTtlMinutes());
    } catch (IdentityProviderException e) {
      log.warn("Magic link authentication failed: {}", e.getMessage());
      return entryPoint(REASON_AUTH_FAILED);
    }

    // a fresh primary login starts the second factor over
    cookieStore.write(response, CookieKind.PRIMARY_SESSION, session.sessionToken());
    cookieStore.clear(response, CookieKind.PHONE_CHALLENGE);
    cookieStore.clear(response, CookieKind.STEP_UP);

    log.info("Primary factor complete for subject {}", session.subjectId());
    return frontendUri(properties.frontend().secondFactorPath()).build().toUri();
  }

  /**
   * Starts the second factor by sending an SMS code. Each call replaces the previous challenge.
   *
   * @param phoneE164 phone number already normalized by {@link PhoneNumbers#toE164(String)}
   */
  public void requestOtp(String phoneE164, HttpServletRequest request, HttpServletResponse response) {
    if (!PhoneNumbers.isE164(phoneE164)) {
      throw new InvalidInputException("Invalid phone");
    }

    Optional<String> primarySession = primarySessionForBinding(request);

    String challengeId;
    try {
      challengeId = identityProvider.sendOtp(phoneE164, primarySession);
    } catch (IdentityProviderRejectedException e) {
      log.warn("SMS code request to {} rejected: {}", LogMasking.maskPhone(phoneE164), e.getErrorType());
      if (primarySession.isPresent() && isSessionError(e)) {
        throw new NoActiveSessionException("No active session.");
      }
      throw new InvalidInputException("Failed to send code");
    } catch (IdentityProviderException e) {
      log.error("SMS code request to {} failed", LogMasking.maskPhone(phoneE164), e);
      throw new ProviderErrorException("Failed to send code", e);
    }

    cookieStore.write(response, CookieKind.PHONE_CHALLENGE, challengeId);
    log.info("SMS code sent to {}", LogMasking.maskPhone(phoneE164));

    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("phone", LogMasking.maskPhone(phoneE164));
    fields.put("bound", primarySession.isPresent());
    accessLog.record(AccessEventKind.OTP_REQUESTED, fields);
  }

  /**
   * Finishes the second factor. On success the browser holds a step-up credential and its
   * challenge is cleared; on a rejected code nothing changes so the user can try again.
   */
  public StepUpClaims consumeOtp(String code, HttpServletRequest request, HttpServletResponse response) {
    if (code == null || code.isBlank()) {
      throw new InvalidInputException("Missing code");
    }
    String trimmedCode = code.trim();
    if (!NUMERIC_CODE.matcher(trimmedCode).matches()) {
      throw new InvalidInputException("Invalid code");
    }

    String challengeId = cookieStore.read(request, CookieKind.PHONE_CHALLENGE)
        .orElseThrow(() -> new ChallengeExpiredException("Session expired, resend code."));
    Optional<String> primarySession = primarySessionForBinding(request);

    ProviderSession session;
    try {
      session = identityProvider.authenticateOtp(challengeId, trimmedCode, primarySession,
                                                 properties.identityProvider().sessionTtlMinutes());
    } catch (IdentityProviderRejectedException e) {
      log.warn("SMS code rejected: {}", e.getErrorType());
      throw new InvalidCodeException("Invalid code", e);
    } catch (NoSessionIssuedException e) {
      log.error("SMS code accepted but no session issued", e);
      throw new ProviderErrorException("Session error", e);
    } catch (IdentityProviderException e) {
      log.error("SMS code verification failed", e);
      throw new ProviderErrorException("Verification failed", e);
    }

    String credential = credentialSigner.issue(session.subjectId(), true, properties.stepUp().ttl());
    cookieStore.write(response, CookieKind.PRIMARY_SESSION, session.sessionToken());
    cookieStore.write(response, CookieKind.STEP_UP, credential);
    cookieStore.clear(response, CookieKind.PHONE_CHALLENGE);

    log.info("Second factor complete for subject {}", session.subjectId());
    accessLog.record(AccessEventKind.STEP_UP_COMPLETED, Map.of("subjectId", session.subjectId()));

    return credentialSigner.verify(credential)
        .orElseThrow(() -> new CredentialSigningException("Freshly issued credential does not verify"));
  }

  /**
   * Derives the browser's state from its cookies alone.
   */
  public AuthState currentState(HttpServletRequest request) {
    boolean stepUpComplete = cookieStore.read(request, CookieKind.STEP_UP)
        .flatMap(credentialSigner::verify)
        .map(StepUpClaims::secondFactorSatisfied)
        .orElse(false);
    if (stepUpComplete) {
      return AuthState.STEP_UP_COMPLETE;
    }
    if (cookieStore.read(request, CookieKind.PHONE_CHALLENGE).isPresent()) {
      return AuthState.OTP_SENT;
    }
    if (cookieStore.read(request, CookieKind.PRIMARY_SESSION).isPresent()) {
      return AuthState.PRIMARY_AUTHENTICATED;
    }
    return AuthState.ANONYMOUS;
  }

  /**
   * Returns the browser to ANONYMOUS by expiring every flow cookie.
   */
  public void logout(HttpServletResponse response) {
    for (CookieKind kind : CookieKind.values()) {
      cookieStore.clear(response, kind);
    }
    log.debug("Flow cookies cleared");
  }

  public URI entryPoint(String reason) {
    UriComponentsBuilder builder = frontendUri(properties.frontend().entryPath());
    if (reason != null) {
      builder.queryParam("err", reason);
    }
    return builder.build().toUri();
  }

  private Optional<String> primarySessionForBinding(HttpServletRequest request) {
    ApplicationProperties.OtpProperties otp = properties.otp();
    Optional<String> primarySession = cookieStore.read(request, CookieKind.PRIMARY_SESSION);

    if (primarySession.isEmpty()) {
      if (otp.requirePrimarySession()) {
        throw new NoActiveSessionException("No active session.");
      }
      log.warn("Second factor without a primary session; provider will log in or create by phone");
      return Optional.empty();
    }
    return otp.bindToPrimarySession() ? primarySession : Optional.empty();
  }

  private boolean isSessionError(IdentityProviderRejectedException e) {
    return e.getErrorType() != null && e.getErrorType().startsWith("session_");
  }

  private String linkConsumeUrl() {
    return UriComponentsBuilder.fromHttpUrl(properties.publicBaseUrl())
        .path(LINK_CONSUME_PATH)
        .build()
        .toUriString();
  }

  private UriComponentsBuilder frontendUri(String path) {
    return UriComponentsBuilder.fromHttpUrl(properties.frontend().url()).path(path);
  }

  private Map<String, Object> leadFields(String email, String phone, ClientMetadata client) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("email", email);
    fields.put("phone", phone != null && !phone.isBlank() ? phone : null);
    fields.put("referrer", client != null ? client.referrer() : null);
    fields.put("ip", client != null ? client.clientIp() : null);
    fields.put("userAgent", client != null ? client.userAgent() : null);
    return fields;
  }
}
