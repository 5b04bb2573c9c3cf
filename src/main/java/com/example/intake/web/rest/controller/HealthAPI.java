package com.example.intake.web.rest.controller;

import static com.example.intake.web.rest.ApiConstants.ApiPath.*;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.Map;

@Tag(
    name = "Health",
    description = "Flow availability as seen from the identity provider circuit breaker"
)
@RequestMapping(
    value = HEALTH_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface HealthAPI {

  @Operation(
      summary = "Flow health",
      description = "UP while identity provider calls are let through, DEGRADED while the circuit "
          + "breaker is short-circuiting them. Never calls the provider."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Status returned")
  })
  @GetMapping
  ResponseEntity<Map<String, Object>> health();
}
