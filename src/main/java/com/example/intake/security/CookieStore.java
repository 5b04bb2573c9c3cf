package com.example.intake.security;

import com.example.intake.properties.ApplicationProperties;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.web.util.WebUtils;

import java.util.Optional;

/**
 * Reads and writes the flow's cookies using Spring's ResponseCookie builder.
 * <p>
 * Path, lifetime and HTTP-only come from {@link CookieKind} and cannot be changed by callers.
 * Secure, SameSite and domain come from deployment configuration.
 */
@Slf4j
@Component
public class CookieStore {

  private final boolean secure;
  private final String sameSite;
  private final String domain;

  @Autowired
  public CookieStore(ApplicationProperties properties) {
    this(properties.cookies());
  }

  public CookieStore(ApplicationProperties.CookieProperties cookies) {
    this.secure = cookies.secure();
    this.sameSite = cookies.sameSite();
    this.domain = cookies.domain();
  }

  /**
   * Reads a cookie value; blank values count as absent.
   */
  public Optional<String> read(HttpServletRequest request, CookieKind kind) {
    if (request == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(WebUtils.getCookie(request, kind.cookieName()))
        .map(Cookie::getValue)
        .filter(value -> !value.isBlank());
  }

  public void write(HttpServletResponse response, CookieKind kind, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Cookie value cannot be null or empty: " + kind);
    }
    response.addHeader(HttpHeaders.SET_COOKIE, build(kind, value, kind.maxAge().toSeconds()).toString());
    log.debug("Set cookie: name={}, maxAge={}s, secure={}, sameSite={}",
              kind.cookieName(), kind.maxAge().toSeconds(), secure, sameSite);
  }

  /**
   * Expires the cookie immediately. Attributes must match the ones it was written with.
   */
  public void clear(HttpServletResponse response, CookieKind kind) {
    response.addHeader(HttpHeaders.SET_COOKIE, build(kind, "", 0).toString());
    log.debug("Cleared cookie: name={}", kind.cookieName());
  }

  private ResponseCookie build(CookieKind kind, String value, long maxAgeSeconds) {
    ResponseCookie.ResponseCookieBuilder builder = ResponseCookie
        .from(kind.cookieName(), value)
        .httpOnly(true)
        .secure(secure)
        .path(CookieKind.PATH)
        .maxAge(maxAgeSeconds)
        .sameSite(sameSite);

    if (domain != null && !domain.isBlank()) {
      builder.domain(domain);
    }
    return builder.build();
  }
}
