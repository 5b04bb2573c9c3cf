package com.example.intake.security;

import com.example.intake.properties.ApplicationProperties.CookieProperties;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CookieStoreTest {

  private final CookieStore cookieStore = new CookieStore(new CookieProperties(true, "Lax", null));

  @Test
  void shouldWritePrimarySessionWithFixedAttributes() {
    MockHttpServletResponse response = new MockHttpServletResponse();

    cookieStore.write(response, CookieKind.PRIMARY_SESSION, "session-token");

    String header = response.getHeader(HttpHeaders.SET_COOKIE);
    assertThat(header, startsWith("intake_session=session-token"));
    assertThat(header, containsString("Path=/"));
    assertThat(header, containsString("Max-Age=3600"));
    assertThat(header, containsString("HttpOnly"));
    assertThat(header, containsString("Secure"));
    assertThat(header, containsString("SameSite=Lax"));
    assertThat(header, not(containsString("Domain=")));
  }

  @Test
  void shouldWritePhoneChallengeWithFifteenMinuteLifetime() {
    MockHttpServletResponse response = new MockHttpServletResponse();

    cookieStore.write(response, CookieKind.PHONE_CHALLENGE, "phone-number-test-1");

    String header = response.getHeader(HttpHeaders.SET_COOKIE);
    assertThat(header, startsWith("intake_phone_challenge=phone-number-test-1"));
    assertThat(header, containsString("Max-Age=900"));
  }

  @Test
  void shouldWriteStepUpWithOneHourLifetime() {
    MockHttpServletResponse response = new MockHttpServletResponse();

    cookieStore.write(response, CookieKind.STEP_UP, "credential");

    String header = response.getHeader(HttpHeaders.SET_COOKIE);
    assertThat(header, startsWith("intake_mfa=credential"));
    assertThat(header, containsString("Max-Age=3600"));
    assertThat(header, containsString("HttpOnly"));
  }

  @Test
  void shouldHonourDeploymentOverrides() {
    CookieStore relaxed = new CookieStore(new CookieProperties(false, "Strict", "intake.test.local"));
    MockHttpServletResponse response = new MockHttpServletResponse();

    relaxed.write(response, CookieKind.PRIMARY_SESSION, "session-token");

    String header = response.getHeader(HttpHeaders.SET_COOKIE);
    assertThat(header, not(containsString("Secure")));
    assertThat(header, containsString("SameSite=Strict"));
    assertThat(header, containsString("Domain=intake.test.local"));
  }

  @Test
  void shouldExpireOnClear() {
    MockHttpServletResponse response = new MockHttpServletResponse();

    cookieStore.clear(response, CookieKind.STEP_UP);

    String header = response.getHeader(HttpHeaders.SET_COOKIE);
    assertThat(header, startsWith("intake_mfa=;"));
    assertThat(header, containsString("Max-Age=0"));
    assertThat(header, containsString("Path=/"));
  }

  @Test
  void shouldEmitOneHeaderPerCookie() {
    MockHttpServletResponse response = new MockHttpServletResponse();

    cookieStore.write(response, CookieKind.PRIMARY_SESSION, "session-token");
    cookieStore.clear(response, CookieKind.PHONE_CHALLENGE);

    List<String> headers = response.getHeaders(HttpHeaders.SET_COOKIE);
    assertThat(headers, hasSize(2));
  }

  @Test
  void shouldRefuseBlankValue() {
    MockHttpServletResponse response = new MockHttpServletResponse();

    assertThrows(IllegalArgumentException.class,
                 () -> cookieStore.write(response, CookieKind.PRIMARY_SESSION, " "));
  }

  @Test
  void shouldReadPresentCookie() {
    MockHttpServletRequest request = new MockHttpServletRequest();
    request.setCookies(new Cookie("intake_phone_challenge", "phone-number-test-1"));

    assertEquals("phone-number-test-1",
                 cookieStore.read(request, CookieKind.PHONE_CHALLENGE).orElseThrow());
    assertTrue(cookieStore.read(request, CookieKind.PRIMARY_SESSION).isEmpty());
  }

  @Test
  void shouldTreatBlankCookieAsAbsent() {
    MockHttpServletRequest request = new MockHttpServletRequest();
    request.setCookies(new Cookie("intake_session", ""));

    assertTrue(cookieStore.read(request, CookieKind.PRIMARY_SESSION).isEmpty());
  }
}
