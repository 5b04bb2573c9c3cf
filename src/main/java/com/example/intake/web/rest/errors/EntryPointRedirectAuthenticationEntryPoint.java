package com.example.intake.web.rest.errors;

import com.example.intake.properties.ApplicationProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;

/**
 * Sends browsers without a valid step-up credential back to the start of the flow.
 * <p>
 * Protected paths serve pages, not an API, so instead of a 401 body the client gets a plain
 * redirect to the entry point. The response carries no detail about why the credential failed.
 */
@Component
@RequiredArgsConstructor
public class EntryPointRedirectAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private final ApplicationProperties properties;

  @Override
  public void commence(HttpServletRequest request, HttpServletResponse response,
                       AuthenticationException authException) throws IOException {
    String entryPoint = UriComponentsBuilder.fromHttpUrl(properties.frontend().url())
        .path(properties.frontend().entryPath())
        .toUriString();

    response.setHeader(HttpHeaders.CACHE_CONTROL, "no-cache, no-store, must-revalidate");
    response.sendRedirect(entryPoint);
  }
}
