package com.example.intake.web.rest.controller;

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasEntry;
import static org.junit.jupiter.api.Assertions.assertEquals;

class HealthControllerTest {

  private final CircuitBreakerRegistry registry = CircuitBreakerRegistry.ofDefaults();
  private final HealthController controller = new HealthController(registry);

  @Test
  void shouldBeUpWhileProviderCallsPassThrough() {
    ResponseEntity<Map<String, Object>> response = controller.health();

    assertEquals(HttpStatus.OK, response.getStatusCode());
    assertThat(response.getBody(), hasEntry("status", (Object) "UP"));
    assertThat(response.getBody(), hasEntry("identityProvider", (Object) "CLOSED"));
  }

  @Test
  void shouldBeDegradedWhileCircuitIsOpen() {
    registry.circuitBreaker("identityProvider").transitionToOpenState();

    ResponseEntity<Map<String, Object>> response = controller.health();

    assertEquals(HttpStatus.OK, response.getStatusCode());
    assertThat(response.getBody(), hasEntry("status", (Object) "DEGRADED"));
    assertThat(response.getBody(), hasEntry("identityProvider", (Object) "OPEN"));
  }

  @Test
  void shouldBeUpWhileCircuitIsHalfOpen() {
    registry.circuitBreaker("identityProvider").transitionToOpenState();
    registry.circuitBreaker("identityProvider").transitionToHalfOpenState();

    assertThat(controller.health().getBody(), hasEntry("status", (Object) "UP"));
  }
}
