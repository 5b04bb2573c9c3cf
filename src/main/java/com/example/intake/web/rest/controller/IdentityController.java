package com.example.intake.web.rest.controller;

import com.example.intake.domain.entity.StepUpClaims;
import com.example.intake.service.CurrentIdentityService;
import com.example.intake.web.rest.dto.CurrentIdentityResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

/**
 * Served only behind the step-up gate.
 */
@RestController
@RequiredArgsConstructor
public class IdentityController implements IdentityAPI {

  private final CurrentIdentityService currentIdentityService;

  @Override
  public ResponseEntity<CurrentIdentityResponse> me(StepUpClaims claims, HttpServletRequest request) {
    return ResponseEntity.ok(currentIdentityService.currentIdentity(claims, request));
  }
}
