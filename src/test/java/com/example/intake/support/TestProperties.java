package com.example.intake.support;

import com.example.intake.properties.ApplicationProperties;
import com.example.intake.properties.ApplicationProperties.AccessLogProperties;
import com.example.intake.properties.ApplicationProperties.CookieProperties;
import com.example.intake.properties.ApplicationProperties.FrontendProperties;
import com.example.intake.properties.ApplicationProperties.IdentityProviderProperties;
import com.example.intake.properties.ApplicationProperties.OkHttpProperties;
import com.example.intake.properties.ApplicationProperties.OtpProperties;
import com.example.intake.properties.ApplicationProperties.ProviderEnvironment;
import com.example.intake.properties.ApplicationProperties.StepUpProperties;

import java.time.Duration;
import java.util.List;

/**
 * Builds {@link ApplicationProperties} for unit tests without a Spring context.
 */
public final class TestProperties {

  public static final String PUBLIC_BASE_URL = "https://gateway.test.local";
  public static final String FRONTEND_URL = "https://intake.test.local";
  public static final String SIGNING_SECRET = "test-signing-secret-0123456789abcdef-0123456789";

  private String publicBaseUrl = PUBLIC_BASE_URL;
  private FrontendProperties frontend = new FrontendProperties(FRONTEND_URL, "/request-access", "/mfa");
  private IdentityProviderProperties identityProvider = new IdentityProviderProperties(
      "project-test-00000000-0000-0000-0000-000000000000", "secret-test-value",
      ProviderEnvironment.TEST, null, 60);
  private StepUpProperties stepUp = new StepUpProperties(SIGNING_SECRET, Duration.ofHours(1),
                                                         List.of("/app", "/result"));
  private OtpProperties otp = new OtpProperties(true, false);
  private CookieProperties cookies = new CookieProperties(true, "Lax", null);
  private OkHttpProperties http = new OkHttpProperties(new OkHttpProperties.ClientProperties(
      20, 5, 100, 20, Duration.ofSeconds(3), Duration.ofSeconds(5), Duration.ofSeconds(10)));
  private AccessLogProperties accessLog = new AccessLogProperties(null);

  public static TestProperties defaults() {
    return new TestProperties();
  }

  public TestProperties publicBaseUrl(String value) {
    this.publicBaseUrl = value;
    return this;
  }

  public TestProperties frontend(FrontendProperties value) {
    this.frontend = value;
    return this;
  }

  public TestProperties identityProvider(IdentityProviderProperties value) {
    this.identityProvider = value;
    return this;
  }

  public TestProperties stepUp(StepUpProperties value) {
    this.stepUp = value;
    return this;
  }

  public TestProperties otp(boolean bindToPrimarySession, boolean requirePrimarySession) {
    this.otp = new OtpProperties(bindToPrimarySession, requirePrimarySession);
    return this;
  }

  public TestProperties cookies(CookieProperties value) {
    this.cookies = value;
    return this;
  }

  public TestProperties http(OkHttpProperties.ClientProperties value) {
    this.http = new OkHttpProperties(value);
    return this;
  }

  public TestProperties accessLog(String url) {
    this.accessLog = new AccessLogProperties(url);
    return this;
  }

  public ApplicationProperties build() {
    return new ApplicationProperties(publicBaseUrl, frontend, identityProvider, stepUp, otp,
                                     cookies, http, accessLog);
  }
}
