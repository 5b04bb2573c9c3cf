package com.example.intake.security;

import com.example.intake.domain.entity.StepUpClaims;
import com.example.intake.exception.CredentialSigningException;
import com.example.intake.properties.ApplicationProperties;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.KeyLengthException;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Optional;

/**
 * Issues and verifies the step-up credential: an HS256 JWT carrying the subject, the
 * second-factor claim, issue time and absolute expiry.
 * <p>
 * The signing secret is read once from configuration; rotating it invalidates every credential
 * already issued. Verification failures are not differentiated to callers.
 */
@Slf4j
@Component
public class StepUpCredentialSigner {

  static final String SECOND_FACTOR_CLAIM = "mfa";

  private final JWSSigner signer;
  private final JWSVerifier verifier;
  private final Clock clock;

  @Autowired
  public StepUpCredentialSigner(ApplicationProperties properties, Clock clock) {
    this(properties.stepUp().signingSecret(), clock);
  }

  public StepUpCredentialSigner(String signingSecret, Clock clock) {
    byte[] secret = signingSecret.getBytes(StandardCharsets.UTF_8);
    try {
      this.signer = new MACSigner(secret);
      this.verifier = new MACVerifier(secret);
    } catch (KeyLengthException e) {
      throw new IllegalStateException("Step-up signing secret must be at least 256 bits", e);
    } catch (JOSEException e) {
      throw new IllegalStateException("Cannot initialize step-up credential verifier", e);
    }
    this.clock = clock;
  }

  /**
   * Mints a credential valid from now until now + ttl.
   */
  public String issue(String subjectId, boolean secondFactorSatisfied, Duration ttl) {
    if (subjectId == null || subjectId.isBlank()) {
      throw new IllegalArgumentException("Subject cannot be null or empty");
    }

    // JWT dates carry whole seconds
    Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    JWTClaimsSet claims = new JWTClaimsSet.Builder()
        .subject(subjectId)
        .claim(SECOND_FACTOR_CLAIM, secondFactorSatisfied)
        .issueTime(Date.from(issuedAt))
        .expirationTime(Date.from(issuedAt.plus(ttl)))
        .build();

    SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
    try {
      jwt.sign(signer);
    } catch (JOSEException e) {
      throw new CredentialSigningException("Failed to sign step-up credential", e);
    }
    return jwt.serialize();
  }

  /**
   * Checks signature and expiry together. A credential is expired from its expiry instant on.
   *
   * @return the claims, or empty for any malformed, tampered, foreign-key or expired credential
   */
  public Optional<StepUpClaims> verify(String credential) {
    if (credential == null || credential.isBlank()) {
      return Optional.empty();
    }

    try {
      SignedJWT jwt = SignedJWT.parse(credential);
      if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm()) || !jwt.verify(verifier)) {
        log.debug("Step-up credential rejected");
        return Optional.empty();
      }

      JWTClaimsSet claims = jwt.getJWTClaimsSet();
      Date expiration = claims.getExpirationTime();
      if (expiration == null || claims.getSubject() == null
          || !clock.instant().isBefore(expiration.toInstant())) {
        log.debug("Step-up credential rejected");
        return Optional.empty();
      }

      Boolean secondFactor = claims.getBooleanClaim(SECOND_FACTOR_CLAIM);
      Date issueTime = claims.getIssueTime();
      return Optional.of(new StepUpClaims(
          claims.getSubject(),
          Boolean.TRUE.equals(secondFactor),
          issueTime != null ? issueTime.toInstant() : null,
          expiration.toInstant()
      ));

    } catch (ParseException | JOSEException e) {
      log.debug("Step-up credential rejected: {}", e.getClass().getSimpleName());
      return Optional.empty();
    }
  }
}
