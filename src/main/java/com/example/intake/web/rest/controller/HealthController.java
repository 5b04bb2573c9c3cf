package com.example.intake.web.rest.controller;

import com.example.intake.adapter.idp.StytchIdentityProvider;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Reports whether the two-factor flow can currently reach the identity provider. The answer comes
 * from the provider circuit breaker, so a health check never sends an email or SMS.
 * Process liveness is left to the actuator.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController implements HealthAPI {

  static final String STATUS_UP = "UP";
  static final String STATUS_DEGRADED = "DEGRADED";

  private static final Set<CircuitBreaker.State> SHORT_CIRCUITED =
      Set.of(CircuitBreaker.State.OPEN, CircuitBreaker.State.FORCED_OPEN);

  private final CircuitBreakerRegistry circuitBreakerRegistry;

  @Override
  public ResponseEntity<Map<String, Object>> health() {
    CircuitBreaker.State state = circuitBreakerRegistry
        .circuitBreaker(StytchIdentityProvider.CIRCUIT_BREAKER)
        .getState();

    boolean degraded = SHORT_CIRCUITED.contains(state);
    if (degraded) {
      log.warn("Identity provider circuit breaker is {}", state);
    }

    Map<String, Object> response = new LinkedHashMap<>();
    response.put("status", degraded ? STATUS_DEGRADED : STATUS_UP);
    response.put("identityProvider", state.name());
    response.put("timestamp", System.currentTimeMillis());
    return ResponseEntity.ok(response);
  }
}
