package com.example.intake.service;

import com.example.intake.adapter.idp.IdentityProvider;
import com.example.intake.adapter.idp.dto.ProviderUser;
import com.example.intake.domain.entity.StepUpClaims;
import com.example.intake.exception.IdentityProviderException;
import com.example.intake.security.CookieKind;
import com.example.intake.security.CookieStore;
import com.example.intake.web.rest.dto.CurrentIdentityResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Looks up contact details for a browser that has completed step-up, using its primary session.
 * Lookup failures degrade to an identity without contact details.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CurrentIdentityService {

  private final IdentityProvider identityProvider;
  private final CookieStore cookieStore;

  public CurrentIdentityResponse currentIdentity(StepUpClaims claims, HttpServletRequest request) {
    Optional<String> sessionToken = cookieStore.read(request, CookieKind.PRIMARY_SESSION);
    if (sessionToken.isEmpty()) {
      log.debug("No primary session for subject {}", claims.subjectId());
      return anonymousContact(claims);
    }

    try {
      String sessionSubject = identityProvider.authenticateSession(sessionToken.get());
      if (!sessionSubject.equals(claims.subjectId())) {
        log.warn("Primary session subject does not match step-up subject {}", claims.subjectId());
        return anonymousContact(claims);
      }

      ProviderUser user = identityProvider.getUser(sessionSubject);
      return new CurrentIdentityResponse(claims.subjectId(), user.email(), user.phone());

    } catch (IdentityProviderException e) {
      log.warn("Contact lookup for subject {} failed: {}", claims.subjectId(), e.getMessage());
      return anonymousContact(claims);
    }
  }

  private CurrentIdentityResponse anonymousContact(StepUpClaims claims) {
    return new CurrentIdentityResponse(claims.subjectId(), null, null);
  }
}
