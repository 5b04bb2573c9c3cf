package com.example.intake.security.filter;

import com.example.intake.domain.entity.StepUpClaims;
import com.example.intake.security.CookieKind;
import com.example.intake.security.CookieStore;
import com.example.intake.security.StepUpCredentialSigner;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.preauth.PreAuthenticatedAuthenticationToken;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * Authenticates requests to protected paths from the step-up credential cookie.
 * <p>
 * Only a credential that verifies, has not expired and carries a satisfied second factor
 * yields an authentication. Anything else leaves the request anonymous and the security
 * chain's entry point redirects it. The filter never writes cookies or calls the identity provider.
 */
@Slf4j
@RequiredArgsConstructor
public class StepUpCredentialFilter extends OncePerRequestFilter {

  public static final String STEP_UP_AUTHORITY = "STEP_UP";

  private final CookieStore cookieStore;
  private final StepUpCredentialSigner credentialSigner;

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain
                                 ) throws ServletException, IOException {

    Optional<StepUpClaims> claims = cookieStore.read(request, CookieKind.STEP_UP)
        .flatMap(credentialSigner::verify)
        .filter(StepUpClaims::secondFactorSatisfied);

    if (claims.isPresent()) {
      PreAuthenticatedAuthenticationToken authentication = new PreAuthenticatedAuthenticationToken(
          claims.get(), null, AuthorityUtils.createAuthorityList(STEP_UP_AUTHORITY));

      SecurityContext context = SecurityContextHolder.createEmptyContext();
      context.setAuthentication(authentication);
      SecurityContextHolder.setContext(context);
      log.trace("Step-up credential accepted for subject {}", claims.get().subjectId());
    } else {
      log.debug("No valid step-up credential for {}", request.getRequestURI());
    }

    filterChain.doFilter(request, response);
  }
}
