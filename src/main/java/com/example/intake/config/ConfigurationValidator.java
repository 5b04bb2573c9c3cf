package com.example.intake.config;

import com.example.intake.properties.ApplicationProperties;
import com.example.intake.properties.ApplicationProperties.ProviderEnvironment;
import com.example.intake.security.CookieKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

import java.net.MalformedURLException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration validator that enforces business rules and constraints
 * beyond basic JSR-303 validation. Collects every violation, then fails startup once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_INVALID_URL = "%s is invalid: %s";
  private static final String ERROR_HTTPS_REQUIRED = "%s must use HTTPS in non-local environments: %s";
  private static final String PROTOCOL_HTTP = "http://";
  private static final String PROTOCOL_HTTPS = "https://";
  private static final String HOST_LOCALHOST = "localhost";
  private static final String HOST_LOOPBACK = "127.0.0.1";
  private static final String PATH_PREFIX_SLASH = "/";
  private static final String PATH_TRAVERSAL_SEQUENCE = "..";
  private static final String TEST_PROJECT_PREFIX = "project-test-";
  private static final String SAME_SITE_NONE = "None";
  private static final int MIN_SECRET_BYTES = 32;

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration business rules...");
    List<String> errors = new ArrayList<>();

    validateUrls(errors);
    validateFrontendPaths(errors);
    validateIdentityProvider(errors);
    validateStepUp(errors);
    validateCookies(errors);
    validateHttpConfig(errors);

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully.");
  }

  private void validateUrls(List<String> errors) {
    validateUrl(properties.frontend().url(), "Frontend URL", errors);
    validateUrl(properties.publicBaseUrl(), "Public base URL", errors);

    String providerBaseUrl = properties.identityProvider().baseUrl();
    if (providerBaseUrl != null && !providerBaseUrl.isBlank()) {
      validateUrl(providerBaseUrl, "Identity provider base URL", errors);
    }
    if (properties.accessLog().enabled()) {
      if (!isValidUrl(properties.accessLog().url())) {
        errors.add(ERROR_INVALID_URL.formatted("Access log URL", properties.accessLog().url()));
      }
    }
  }

  private void validateFrontendPaths(List<String> errors) {
    validatePath(properties.frontend().entryPath(), "Entry path", errors);
    validatePath(properties.frontend().secondFactorPath(), "Second-factor path", errors);
  }

  private void validateIdentityProvider(List<String> errors) {
    ApplicationProperties.IdentityProviderProperties provider = properties.identityProvider();
    if (provider.environment() == ProviderEnvironment.LIVE
        && provider.projectId().startsWith(TEST_PROJECT_PREFIX)) {
      errors.add("Identity provider environment is LIVE but the project id is a test project: "
                     + provider.projectId());
    }
  }

  private void validateStepUp(List<String> errors) {
    ApplicationProperties.StepUpProperties stepUp = properties.stepUp();

    if (stepUp.signingSecret().getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
      errors.add("Step-up signing secret must be at least %d bytes for HS256.".formatted(MIN_SECRET_BYTES));
    }

    Duration cookieLifetime = CookieKind.STEP_UP.maxAge();
    if (stepUp.ttl().isZero() || stepUp.ttl().isNegative()) {
      errors.add("Step-up credential TTL must be positive.");
    } else if (stepUp.ttl().compareTo(cookieLifetime) > 0) {
      errors.add("Step-up credential TTL (%s) cannot exceed the step-up cookie lifetime (%s)."
                     .formatted(stepUp.ttl(), cookieLifetime));
    }

    for (String prefix : stepUp.protectedPrefixes()) {
      validatePath(prefix, "Protected prefix", errors);
      if (PATH_PREFIX_SLASH.equals(prefix)) {
        errors.add("Protected prefix cannot be the site root.");
      }
      if (SecurityConfig.PUBLIC_PATH_PREFIXES.stream().anyMatch(pub -> overlaps(prefix, pub))) {
        errors.add("Protected prefix overlaps a public path: " + prefix);
      }
    }
  }

  private void validateCookies(List<String> errors) {
    ApplicationProperties.CookieProperties cookies = properties.cookies();
    if (!cookies.secure() && (isHttps(properties.publicBaseUrl()) || isHttps(properties.frontend().url()))) {
      errors.add("Cookies must be Secure when the site is served over HTTPS.");
    }
    if (!cookies.secure() && properties.identityProvider().environment() == ProviderEnvironment.LIVE) {
      errors.add("Cookies must be Secure when the identity provider environment is LIVE.");
    }
    if (!cookies.secure() && SAME_SITE_NONE.equals(cookies.sameSite())) {
      errors.add("SameSite=None cookies must be Secure.");
    }
  }

  private void validateHttpConfig(List<String> errors) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    if (client.maxRequests() < client.maxRequestsPerHost()) {
      errors.add("Total max requests must be greater than or equal to max requests per host.");
    }
    if (client.callTimeout().isZero() || client.callTimeout().isNegative()) {
      errors.add("Identity provider call timeout must be positive.");
    } else if (client.callTimeout().compareTo(client.connectTimeout()) < 0) {
      errors.add("Identity provider call timeout must not be shorter than the connect timeout.");
    }
  }

  private void validateUrl(String url, String fieldName, List<String> errors) {
    if (!isValidUrl(url)) {
      errors.add(ERROR_INVALID_URL.formatted(fieldName, url));
      return;
    }
    if (url.startsWith(PROTOCOL_HTTP) && !url.contains(HOST_LOCALHOST) && !url.contains(HOST_LOOPBACK)) {
      errors.add(ERROR_HTTPS_REQUIRED.formatted(fieldName, url));
    }
  }

  private void validatePath(String path, String fieldName, List<String> errors) {
    if (!path.startsWith(PATH_PREFIX_SLASH)) {
      errors.add("%s must start with a '/': %s".formatted(fieldName, path));
    }
    if (path.contains(PATH_TRAVERSAL_SEQUENCE)) {
      errors.add("%s cannot contain path traversal sequence '..': %s".formatted(fieldName, path));
    }
  }

  // whole path segments: "/authors" does not overlap "/auth"
  private static boolean overlaps(String prefix, String publicPrefix) {
    String normalized = prefix.endsWith(PATH_PREFIX_SLASH) && prefix.length() > 1
                        ? prefix.substring(0, prefix.length() - 1) : prefix;
    return normalized.equals(publicPrefix)
        || normalized.startsWith(publicPrefix + PATH_PREFIX_SLASH)
        || publicPrefix.startsWith(normalized + PATH_PREFIX_SLASH);
  }

  private static boolean isHttps(String url) {
    return url != null && url.regionMatches(true, 0, PROTOCOL_HTTPS, 0, PROTOCOL_HTTPS.length());
  }

  private boolean isValidUrl(String url) {
    try {
      new URL(url);
      return true;
    } catch (MalformedURLException e) {
      return false;
    }
  }
}
