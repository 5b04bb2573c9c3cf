package com.example.intake.util;

import lombok.experimental.UtilityClass;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Masking helpers for anything that ends up in a log line or a telemetry event.
 * Credential material is replaced outright; contact details are partially masked.
 */
@UtilityClass
public class LogMasking {

  private static final String REDACTED = "***";
  private static final Set<String> SECRET_KEY_FRAGMENTS =
      Set.of("token", "session", "code", "challenge", "credential", "secret", "password");

  /**
   * Returns a copy of the fields with every credential-like value replaced.
   */
  public static Map<String, Object> redact(Map<String, Object> fields) {
    Map<String, Object> safe = new LinkedHashMap<>();
    if (fields == null) {
      return safe;
    }
    fields.forEach((key, value) -> safe.put(key, isSecretKey(key) ? REDACTED : value));
    return safe;
  }

  /**
   * Returns a copy with email and phone values masked, for log output.
   */
  public static Map<String, Object> maskContactDetails(Map<String, Object> fields) {
    Map<String, Object> masked = new LinkedHashMap<>(fields);
    masked.computeIfPresent("email", (k, v) -> maskEmail(String.valueOf(v)));
    masked.computeIfPresent("phone", (k, v) -> maskPhone(String.valueOf(v)));
    return masked;
  }

  public static String maskEmail(String email) {
    if (email == null) {
      return null;
    }
    int at = email.indexOf('@');
    if (at <= 0) {
      return REDACTED;
    }
    return email.charAt(0) + REDACTED + email.substring(at);
  }

  public static String maskPhone(String phone) {
    if (phone == null) {
      return null;
    }
    if (phone.length() <= 4) {
      return REDACTED;
    }
    return REDACTED + phone.substring(phone.length() - 4);
  }

  private static boolean isSecretKey(String key) {
    String lower = key.toLowerCase(Locale.ROOT);
    return SECRET_KEY_FRAGMENTS.stream().anyMatch(lower::contains);
  }
}
