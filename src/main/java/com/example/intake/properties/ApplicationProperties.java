package com.example.intake.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Centralized configuration properties for the intake gateway.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @NotBlank String publicBaseUrl,
    @NotNull @Valid FrontendProperties frontend,
    @NotNull @Valid IdentityProviderProperties identityProvider,
    @NotNull @Valid StepUpProperties stepUp,
    @DefaultValue @NotNull @Valid OtpProperties otp,
    @DefaultValue @NotNull @Valid CookieProperties cookies,
    @DefaultValue @NotNull @Valid OkHttpProperties http,
    @DefaultValue @NotNull @Valid AccessLogProperties accessLog
) {

  /**
   * Browser application the flow redirects back into
   */
  public record FrontendProperties(
      @NotBlank String url,
      @DefaultValue("/request-access") @NotBlank String entryPath,
      @DefaultValue("/mfa") @NotBlank String secondFactorPath
  ) {}

  /**
   * Identity provider (magic links, SMS one-time codes, sessions)
   */
  public record IdentityProviderProperties(
      @NotBlank String projectId,
      @NotBlank String secret,
      @DefaultValue("TEST") @NotNull ProviderEnvironment environment,
      String baseUrl,
      @DefaultValue("60") @Positive int sessionTtlMinutes
  ) {

    public String resolvedBaseUrl() {
      if (baseUrl != null && !baseUrl.isBlank()) {
        return baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
      }
      return environment.defaultBaseUrl();
    }
  }

  public enum ProviderEnvironment {
    TEST("https://test.stytch.com/v1/"),
    LIVE("https://api.stytch.com/v1/");

    private final String defaultBaseUrl;

    ProviderEnvironment(String defaultBaseUrl) {
      this.defaultBaseUrl = defaultBaseUrl;
    }

    public String defaultBaseUrl() {
      return defaultBaseUrl;
    }
  }

  /**
   * Signed step-up credential and the paths it unlocks
   */
  public record StepUpProperties(
      @NotBlank String signingSecret,
      @DefaultValue("1h") @DurationUnit(ChronoUnit.SECONDS) Duration ttl,
      @DefaultValue({"/app", "/result"}) @NotEmpty List<String> protectedPrefixes
  ) {}

  /**
   * Second-factor binding to the primary session
   */
  public record OtpProperties(
      @DefaultValue("true") boolean bindToPrimarySession,
      @DefaultValue("false") boolean requirePrimarySession
  ) {}

  /**
   * Cookie security attribute overrides, intended for non-production deployments
   */
  public record CookieProperties(
      @DefaultValue("true") boolean secure,
      @DefaultValue("Lax") @Pattern(regexp = "Strict|Lax|None") String sameSite,
      String domain
  ) {}

  /**
   * OkHttp client configuration
   */
  public record OkHttpProperties(
      @DefaultValue @NotNull @Valid ClientProperties client
  ) {
    public record ClientProperties(
        @DefaultValue("20") @Positive int maxIdleConnections,
        @DefaultValue("5") @Positive int keepAliveDurationMinutes,
        @DefaultValue("100") @Positive int maxRequests,
        @DefaultValue("20") @Positive int maxRequestsPerHost,
        @DefaultValue("3s") @DurationUnit(ChronoUnit.SECONDS) Duration connectTimeout,
        @DefaultValue("5s") @DurationUnit(ChronoUnit.SECONDS) Duration readTimeout,
        @DefaultValue("10s") @DurationUnit(ChronoUnit.SECONDS) Duration callTimeout
    ) {}
  }

  /**
   * Lead logging back end; blank disables delivery
   */
  public record AccessLogProperties(String url) {

    public boolean enabled() {
      return url != null && !url.isBlank();
    }
  }
}
