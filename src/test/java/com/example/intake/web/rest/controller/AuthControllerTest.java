package com.example.intake.web.rest.controller;

import com.example.intake.adapter.idp.IdentityProvider;
import com.example.intake.adapter.idp.dto.ProviderSession;
import com.example.intake.exception.IdentityProviderException;
import com.example.intake.exception.IdentityProviderRejectedException;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.redirectedUrl;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AuthControllerTest {

  private static final String PHONE = "+14155551234";

  @Autowired
  private MockMvc mockMvc;

  @MockBean
  private IdentityProvider identityProvider;

  private static List<String> setCookies(MvcResult result) {
    return result.getResponse().getHeaders(HttpHeaders.SET_COOKIE);
  }

  private static String cookieValue(MvcResult result, String name) {
    String header = setCookies(result).stream()
        .filter(h -> h.startsWith(name + "="))
        .findFirst()
        .orElseThrow(() -> new AssertionError("No Set-Cookie for " + name));
    int end = header.indexOf(';');
    return header.substring(name.length() + 1, end < 0 ? header.length() : end);
  }

  @Test
  void shouldRequestMagicLinkWithoutSettingCookies() throws Exception {
    when(identityProvider.sendMagicLink(eq("a@b.com"), anyString(), anyString())).thenReturn("request-id-1");

    MvcResult result = mockMvc.perform(post("/auth/link/request")
                                           .contentType(MediaType.APPLICATION_JSON)
                                           .content("{\"email\":\"a@b.com\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true))
        .andExpect(jsonPath("$.requestId").value("request-id-1"))
        .andReturn();

    assertThat(setCookies(result), empty());
  }

  @Test
  void shouldRejectInvalidEmail() throws Exception {
    mockMvc.perform(post("/auth/link/request")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"not-an-email\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.ok").value(false))
        .andExpect(jsonPath("$.error").value("Invalid email"));
  }

  @Test
  void shouldRejectMalformedBody() throws Exception {
    mockMvc.perform(post("/auth/link/request")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Invalid request body"));
  }

  @Test
  void shouldReportProviderOutageOnLinkRequest() throws Exception {
    when(identityProvider.sendMagicLink(anyString(), anyString(), anyString()))
        .thenThrow(new IdentityProviderException("Identity provider is temporarily unavailable."));

    mockMvc.perform(post("/auth/link/request")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"a@b.com\"}"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.ok").value(false))
        .andExpect(jsonPath("$.error").value("Failed to send magic link"));
  }

  @Test
  void shouldRedirectToEntryPointWhenLinkRejected() throws Exception {
    when(identityProvider.authenticateMagicLink(eq("bad-token"), anyInt()))
        .thenThrow(new IdentityProviderRejectedException(404, "magic_link_not_found", "Not found."));

    MvcResult result = mockMvc.perform(get("/auth/link/consume").param("token", "bad-token"))
        .andExpect(status().isFound())
        .andExpect(redirectedUrl("https://intake.test.local/request-access?err=auth-failed"))
        .andReturn();

    assertThat(setCookies(result), empty());
  }

  @Test
  void shouldRedirectToEntryPointWhenTokenMissing() throws Exception {
    mockMvc.perform(get("/auth/link/consume"))
        .andExpect(status().isFound())
        .andExpect(redirectedUrl("https://intake.test.local/request-access?err=missing-token"));
  }

  @Test
  void shouldSetPrimarySessionAndRedirectToSecondFactor() throws Exception {
    when(identityProvider.authenticateMagicLink(eq("magic-token"), anyInt()))
        .thenReturn(new ProviderSession("session-token-1", "user-test-123"));

    MvcResult result = mockMvc.perform(get("/auth/link/consume").param("token", "magic-token"))
        .andExpect(status().isFound())
        .andExpect(redirectedUrl("https://intake.test.local/mfa"))
        .andExpect(header().string(HttpHeaders.CACHE_CONTROL, containsString("no-store")))
        .andReturn();

    assertThat(setCookies(result), hasItem(startsWith("intake_session=session-token-1")));
  }

  @Test
  void shouldCompleteSecondFactorAfterWrongCode() throws Exception {
    Cookie primary = new Cookie("intake_session", "session-token-1");
    when(identityProvider.sendOtp(PHONE, Optional.of("session-token-1"))).thenReturn("phone-number-test-1");

    MvcResult sent = mockMvc.perform(post("/auth/otp/request")
                                         .cookie(primary)
                                         .contentType(MediaType.APPLICATION_JSON)
                                         .content("{\"phone\":\"(415) 555-1234\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true))
        .andReturn();
    Cookie challenge = new Cookie("intake_phone_challenge", cookieValue(sent, "intake_phone_challenge"));

    when(identityProvider.authenticateOtp(eq("phone-number-test-1"), eq("000000"), eq(Optional.of("session-token-1")), anyInt()))
        .thenThrow(new IdentityProviderRejectedException(401, "otp_code_not_found", "Wrong code."));
    when(identityProvider.authenticateOtp(eq("phone-number-test-1"), eq("123456"), eq(Optional.of("session-token-1")), anyInt()))
        .thenReturn(new ProviderSession("session-token-2", "user-test-123"));

    MvcResult wrong = mockMvc.perform(post("/auth/otp/consume")
                                          .cookie(primary, challenge)
                                          .contentType(MediaType.APPLICATION_JSON)
                                          .content("{\"code\":\"000000\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.ok").value(false))
        .andExpect(jsonPath("$.error").value("Invalid code"))
        .andReturn();
    assertThat(setCookies(wrong), empty());

    MvcResult right = mockMvc.perform(post("/auth/otp/consume")
                                          .cookie(primary, challenge)
                                          .contentType(MediaType.APPLICATION_JSON)
                                          .content("{\"code\":\"123456\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true))
        .andReturn();

    assertThat(setCookies(right), hasItem(startsWith("intake_mfa=ey")));
    assertThat(setCookies(right), hasItem(startsWith("intake_phone_challenge=;")));
    assertThat(setCookies(right), hasItem(startsWith("intake_session=session-token-2")));
  }

  @Test
  void shouldRejectUnnormalizablePhone() throws Exception {
    mockMvc.perform(post("/auth/otp/request")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phone\":\"555-1234\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Invalid phone"));
  }

  @Test
  void shouldRejectMissingPhone() throws Exception {
    mockMvc.perform(post("/auth/otp/request")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Missing phone"));
  }

  @Test
  void shouldRequireChallengeCookie() throws Exception {
    mockMvc.perform(post("/auth/otp/consume")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\":\"123456\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Session expired, resend code."));
  }

  @Test
  void shouldRejectNonJsonBody() throws Exception {
    mockMvc.perform(post("/auth/otp/consume")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("123456"))
        .andExpect(status().isUnsupportedMediaType());
  }

  @Test
  void shouldReportStatusFromCookies() throws Exception {
    mockMvc.perform(get("/auth/status").cookie(new Cookie("intake_session", "session-token-1")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("PRIMARY_AUTHENTICATED"))
        .andExpect(jsonPath("$.authenticated").value(false));
  }

  @Test
  void shouldClearCookiesOnLogout() throws Exception {
    MvcResult result = mockMvc.perform(post("/auth/logout"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true))
        .andReturn();

    assertThat(setCookies(result), hasItem(startsWith("intake_session=;")));
    assertThat(setCookies(result), hasItem(startsWith("intake_phone_challenge=;")));
    assertThat(setCookies(result), hasItem(startsWith("intake_mfa=;")));
  }
}
