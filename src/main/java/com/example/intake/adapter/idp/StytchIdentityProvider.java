package com.example.intake.adapter.idp;

import com.example.intake.adapter.idp.dto.ProviderSession;
import com.example.intake.adapter.idp.dto.ProviderUser;
import com.example.intake.adapter.idp.dto.StytchAuthenticateResponse;
import com.example.intake.adapter.idp.dto.StytchErrorResponse;
import com.example.intake.adapter.idp.dto.StytchSendResponse;
import com.example.intake.adapter.idp.dto.StytchSessionResponse;
import com.example.intake.adapter.idp.dto.StytchUserResponse;
import com.example.intake.exception.IdentityProviderException;
import com.example.intake.exception.IdentityProviderRejectedException;
import com.example.intake.exception.NoSessionIssuedException;
import com.example.intake.properties.ApplicationProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Stytch consumer API client. Each call is a single blocking request bounded by the client's
 * timeouts; nothing is retried because sends have real-world side effects.
 */
@Slf4j
@Component
public class StytchIdentityProvider implements IdentityProvider {

  public static final String CIRCUIT_BREAKER = "identityProvider";
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private static final String MAGIC_LINK_SEND = "magic_links/email/login_or_create";
  private static final String MAGIC_LINK_AUTHENTICATE = "magic_links/authenticate";
  private static final String OTP_SMS_SEND = "otps/sms/send";
  private static final String OTP_SMS_LOGIN_OR_CREATE = "otps/sms/login_or_create";
  private static final String OTP_AUTHENTICATE = "otps/authenticate";
  private static final String SESSION_AUTHENTICATE = "sessions/authenticate";
  private static final String USERS = "users/";

  private final ApplicationProperties.IdentityProviderProperties provider;
  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final String credentials;

  public StytchIdentityProvider(ApplicationProperties properties,
                                @Qualifier("identityProviderOkHttpClient") OkHttpClient httpClient,
                                ObjectMapper objectMapper) {
    this.provider = properties.identityProvider();
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.credentials = Credentials.basic(provider.projectId(), provider.secret());
  }

  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "sendMagicLinkFallback")
  public String sendMagicLink(String email, String loginRedirectUrl, String signupRedirectUrl) {
    log.debug("Requesting magic link from identity provider");

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("email", email);
    body.put("login_magic_link_url", loginRedirectUrl);
    body.put("signup_magic_link_url", signupRedirectUrl);

    StytchSendResponse response = post(MAGIC_LINK_SEND, body, StytchSendResponse.class);
    return isBlank(response.requestId()) ? null : response.requestId();
  }

  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "authenticateMagicLinkFallback")
  public ProviderSession authenticateMagicLink(String token, int sessionTtlMinutes) {
    log.debug("Authenticating magic link token with identity provider");

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("token", token);
    body.put("session_duration_minutes", sessionTtlMinutes);

    return toSession(post(MAGIC_LINK_AUTHENTICATE, body, StytchAuthenticateResponse.class));
  }

  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "sendOtpFallback")
  public String sendOtp(String phoneE164, Optional<String> existingSessionToken) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("phone_number", phoneE164);

    String path = OTP_SMS_LOGIN_OR_CREATE;
    if (existingSessionToken.isPresent()) {
      body.put("session_token", existingSessionToken.get());
      path = OTP_SMS_SEND;
    }
    log.debug("Requesting SMS code via {}", path);

    StytchSendResponse response = post(path, body, StytchSendResponse.class);
    if (response.phoneId() == null || response.phoneId().isBlank()) {
      throw new IdentityProviderException("Identity provider returned no phone challenge identifier");
    }
    return response.phoneId();
  }

  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "authenticateOtpFallback")
  public ProviderSession authenticateOtp(String challengeId, String code,
                                         Optional<String> existingSessionToken,
                                         int sessionTtlMinutes) {
    log.debug("Authenticating SMS code with identity provider");

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("method_id", challengeId);
    body.put("code", code);
    existingSessionToken.ifPresent(token -> body.put("session_token", token));
    body.put("session_duration_minutes", sessionTtlMinutes);

    return toSession(post(OTP_AUTHENTICATE, body, StytchAuthenticateResponse.class));
  }

  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "authenticateSessionFallback")
  public String authenticateSession(String sessionToken) {
    StytchSessionResponse response = post(SESSION_AUTHENTICATE,
                                           Map.of("session_token", sessionToken),
                                           StytchSessionResponse.class);
    if (response.session() == null || isBlank(response.session().userId())) {
      throw new IdentityProviderException("Identity provider returned a session without a subject");
    }
    return response.session().userId();
  }

  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "getUserFallback")
  public ProviderUser getUser(String subjectId) {
    HttpUrl url = HttpUrl.get(provider.resolvedBaseUrl() + USERS).newBuilder()
        .addPathSegment(subjectId)
        .build();
    Request request = new Request.Builder()
        .url(url)
        .header("Authorization", credentials)
        .get()
        .build();

    StytchUserResponse user = execute(request, StytchUserResponse.class);
    return new ProviderUser(
        subjectId,
        firstPresent(user.emails(), StytchUserResponse.Email::email),
        firstPresent(user.phoneNumbers(), StytchUserResponse.PhoneNumber::phoneNumber)
    );
  }

  // Circuit breaker fallbacks. Provider errors pass through untouched; anything else
  // (an open circuit included) is reported as the provider being unavailable.

  public String sendMagicLinkFallback(String email, String loginRedirectUrl,
                                      String signupRedirectUrl, Throwable ex) {
    throw unavailable(ex);
  }

  public ProviderSession authenticateMagicLinkFallback(String token, int sessionTtlMinutes,
                                                       Throwable ex) {
    throw unavailable(ex);
  }

  public String sendOtpFallback(String phoneE164, Optional<String> existingSessionToken,
                                Throwable ex) {
    throw unavailable(ex);
  }

  public ProviderSession authenticateOtpFallback(String challengeId, String code,
                                                 Optional<String> existingSessionToken,
                                                 int sessionTtlMinutes, Throwable ex) {
    throw unavailable(ex);
  }

  public String authenticateSessionFallback(String sessionToken, Throwable ex) {
    throw unavailable(ex);
  }

  public ProviderUser getUserFallback(String subjectId, Throwable ex) {
    throw unavailable(ex);
  }

  private IdentityProviderException unavailable(Throwable ex) {
    if (ex instanceof IdentityProviderException providerException) {
      return providerException;
    }
    log.error("Identity provider circuit breaker rejected the call", ex);
    return new IdentityProviderException("Identity provider is temporarily unavailable.", ex);
  }

  /**
   * One canonical session shape regardless of flow: the opaque token wins, the JWT is the fallback.
   */
  private ProviderSession toSession(StytchAuthenticateResponse response) {
    String sessionToken = !isBlank(response.sessionToken()) ? response.sessionToken()
                                                            : response.sessionJwt();
    if (isBlank(sessionToken)) {
      throw new NoSessionIssuedException("Identity provider authenticated but issued no session");
    }

    String subjectId = !isBlank(response.userId()) ? response.userId()
                                                   : Optional.ofNullable(response.session())
                                                       .map(StytchAuthenticateResponse.StytchSession::userId)
                                                       .orElse(null);
    if (isBlank(subjectId)) {
      throw new NoSessionIssuedException("Identity provider issued a session without a subject");
    }
    return new ProviderSession(sessionToken, subjectId);
  }

  private <T> T post(String path, Map<String, Object> body, Class<T> responseType) {
    String json;
    try {
      json = objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new IdentityProviderException("Failed to serialize identity provider request", e);
    }

    Request request = new Request.Builder()
        .url(provider.resolvedBaseUrl() + path)
        .header("Authorization", credentials)
        .post(RequestBody.create(json, JSON))
        .build();

    return execute(request, responseType);
  }

  private <T> T execute(Request request, Class<T> responseType) {
    try (Response response = httpClient.newCall(request).execute()) {
      ResponseBody responseBody = response.body();
      String payload = responseBody != null ? responseBody.string() : "";

      if (!response.isSuccessful()) {
        throw toProviderError(response.code(), payload);
      }
      return objectMapper.readValue(payload, responseType);

    } catch (JsonProcessingException e) {
      throw new IdentityProviderException("Unreadable identity provider response", e);
    } catch (IOException e) {
      // timeouts surface here as InterruptedIOException
      throw new IdentityProviderException("Identity provider call failed due to network error or timeout", e);
    }
  }

  private IdentityProviderException toProviderError(int status, String payload) {
    if (status >= 400 && status < 500) {
      StytchErrorResponse error = parseError(payload);
      log.warn("Identity provider rejected request: status={}, type={}", status, error.errorType());
      return new IdentityProviderRejectedException(status, error.errorType(), error.errorMessage());
    }
    log.error("Identity provider failed with status {}", status);
    return new IdentityProviderException("Identity provider failed, status: " + status);
  }

  private StytchErrorResponse parseError(String payload) {
    try {
      return objectMapper.readValue(payload, StytchErrorResponse.class);
    } catch (JsonProcessingException e) {
      log.debug("Identity provider error body is not JSON: {}", e.getOriginalMessage());
      return new StytchErrorResponse(null, null, null, null);
    }
  }

  private static <T> String firstPresent(List<T> items, Function<T, String> value) {
    if (items == null) {
      return null;
    }
    return items.stream()
        .map(value)
        .filter(v -> !isBlank(v))
        .findFirst()
        .orElse(null);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
