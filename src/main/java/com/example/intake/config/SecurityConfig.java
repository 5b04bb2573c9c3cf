package com.example.intake.config;

import com.example.intake.properties.ApplicationProperties;
import com.example.intake.security.CookieStore;
import com.example.intake.security.StepUpCredentialSigner;
import com.example.intake.security.filter.StepUpCredentialFilter;
import com.example.intake.web.rest.errors.EntryPointRedirectAuthenticationEntryPoint;
import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer.FrameOptionsConfig;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;
import org.springframework.security.web.header.writers.XXssProtectionHeaderWriter.HeaderValue;

/**
 * Stateless security configuration with three ordered filter chains.
 * <p>
 * PUBLIC CHAIN (@Order(1)): the authentication flow itself, health and API docs.
 * GATE CHAIN (@Order(2)): the configured protected prefixes; {@link StepUpCredentialFilter}
 * admits only browsers holding a valid step-up credential, everyone else is redirected to the
 * entry point. DEFAULT CHAIN (@Order(3)): deny everything else.
 */
@Configuration(proxyBeanMethods = false)
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

  /**
   * Path prefixes served without a step-up credential. Each covers the prefix itself and
   * everything below it.
   */
  public static final List<String> PUBLIC_PATH_PREFIXES =
      List.of("/auth", "/health", "/actuator", "/v3/api-docs", "/swagger-ui");

  private final ApplicationProperties properties;
  private final CookieStore cookieStore;
  private final StepUpCredentialSigner credentialSigner;
  private final EntryPointRedirectAuthenticationEntryPoint entryPointRedirect;

  @Bean
  @Order(1)
  public SecurityFilterChain publicEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher(subtreePatterns(PUBLIC_PATH_PREFIXES))
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(2)
  public SecurityFilterChain stepUpGateFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher(subtreePatterns(properties.stepUp().protectedPrefixes()))
        .addFilterBefore(new StepUpCredentialFilter(cookieStore, credentialSigner),
                         UsernamePasswordAuthenticationFilter.class)
        .authorizeHttpRequests(authorize -> authorize
            .anyRequest().hasAuthority(StepUpCredentialFilter.STEP_UP_AUTHORITY))
        // Redirect rather than 401: protected paths are browser pages
        .exceptionHandling(exceptions -> exceptions
            .authenticationEntryPoint(entryPointRedirect));

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(3)
  public SecurityFilterChain defaultDenyFilterChain(HttpSecurity http) throws Exception {
    http.authorizeHttpRequests(authorize -> authorize.anyRequest().denyAll());
    applyCommonSettings(http);
    return http.build();
  }

  // "/app/**" matches "/app" itself as well as everything below it
  private static String[] subtreePatterns(List<String> prefixes) {
    return prefixes.stream()
        .map(prefix -> prefix.endsWith("/") ? prefix + "**" : prefix + "/**")
        .toArray(String[]::new);
  }

  /**
   * Common security settings applied to all chains
   */
  private void applyCommonSettings(HttpSecurity http) throws Exception {
    http
        // Flow cookies are HttpOnly and SameSite; no server-side session to forge
        .csrf(AbstractHttpConfigurer::disable)
        .sessionManagement(session -> session
                               .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
                          )
        .requestCache(AbstractHttpConfigurer::disable)
        .formLogin(AbstractHttpConfigurer::disable)
        .httpBasic(AbstractHttpConfigurer::disable)
        .logout(AbstractHttpConfigurer::disable)
        .headers(headers -> headers
                     .frameOptions(FrameOptionsConfig::deny)
                     .xssProtection(xss -> xss
                                        .headerValue(HeaderValue.ENABLED_MODE_BLOCK)
                                   )
                     .contentTypeOptions(contentType -> {
                     })
                     .referrerPolicy(referrer -> referrer
                                         .policy(ReferrerPolicy.STRICT_ORIGIN_WHEN_CROSS_ORIGIN)
                                    )
                     .permissionsPolicyHeader(permissions -> permissions
                                                  .policy("camera=(), microphone="
                                                              + "(), geolocation="
                                                              + "(), payment=()")
                                             )
                     // Only effective once the browser has seen the site over HTTPS
                     .httpStrictTransportSecurity(hsts -> hsts
                                                      .maxAgeInSeconds(Duration.ofDays(365).toSeconds())
                                                      .includeSubDomains(true)
                                                 )
                     .contentSecurityPolicy(csp -> csp
                                                .policyDirectives(
                                                    "default-src 'self'; "
                                                        + "frame-ancestors 'none'; "
                                                        + "form-action 'self'; "
                                                        + "base-uri 'self'"
                                                                 )
                                           )
                     // Flow responses carry credentials in Set-Cookie; never cache them
                     .addHeaderWriter((request, response) -> {
                       response.setHeader("Cache-Control",
                                          "no-cache, no-store, must-revalidate");
                       response.setHeader("Pragma",
                                          "no-cache");
                       response.setHeader("Expires",
                                          "0");
                     })
                );
  }
}
