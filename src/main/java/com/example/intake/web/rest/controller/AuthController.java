package com.example.intake.web.rest.controller;

import com.example.intake.domain.entity.AuthState;
import com.example.intake.domain.entity.ClientMetadata;
import com.example.intake.exception.InvalidInputException;
import com.example.intake.service.AuthOrchestrator;
import com.example.intake.util.PhoneNumbers;
import com.example.intake.web.rest.dto.FlowResponse;
import com.example.intake.web.rest.dto.MagicLinkRequest;
import com.example.intake.web.rest.dto.OtpRequest;
import com.example.intake.web.rest.dto.OtpVerification;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.Map;

/**
 * REST controller for the two-factor flow. Validation of provider results and cookie handling
 * live in {@link AuthOrchestrator}; this layer only translates HTTP.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class AuthController implements AuthAPI {

  private final AuthOrchestrator orchestrator;

  @Override
  public ResponseEntity<FlowResponse> requestLink(MagicLinkRequest body, HttpServletRequest request) {
    if (body == null) {
      throw new InvalidInputException("Invalid email");
    }

    String referrer = body.referrer() != null ? body.referrer() : request.getHeader(HttpHeaders.REFERER);
    ClientMetadata client = new ClientMetadata(
        // already resolved from trusted forwarding headers by the container
        request.getRemoteAddr(),
        request.getHeader(HttpHeaders.USER_AGENT),
        referrer
    );

    String requestId = orchestrator.requestMagicLink(body.email(), body.phone(), client);
    return ResponseEntity.ok(FlowResponse.success(requestId));
  }

  @Override
  public ResponseEntity<Void> consumeLink(String token, HttpServletResponse response) {
    URI target = orchestrator.consumeMagicLink(token, response);
    return ResponseEntity.status(302)
        .header(HttpHeaders.CACHE_CONTROL, "no-cache, no-store, must-revalidate")
        .location(target)
        .build();
  }

  @Override
  public ResponseEntity<FlowResponse> requestOtp(OtpRequest body,
                                                 HttpServletRequest request,
                                                 HttpServletResponse response) {
    if (body == null || body.phone() == null || body.phone().isBlank()) {
      throw new InvalidInputException("Missing phone");
    }

    orchestrator.requestOtp(PhoneNumbers.toE164(body.phone()), request, response);
    return ResponseEntity.ok(FlowResponse.success());
  }

  @Override
  public ResponseEntity<FlowResponse> consumeOtp(OtpVerification body,
                                                 HttpServletRequest request,
                                                 HttpServletResponse response) {
    orchestrator.consumeOtp(body != null ? body.code() : null, request, response);
    return ResponseEntity.ok(FlowResponse.success());
  }

  @Override
  public ResponseEntity<Map<String, Object>> status(HttpServletRequest request) {
    AuthState state = orchestrator.currentState(request);
    return ResponseEntity.ok(Map.of(
        "state", state,
        "authenticated", state == AuthState.STEP_UP_COMPLETE,
        "timestamp", System.currentTimeMillis()
                                   ));
  }

  @Override
  public ResponseEntity<FlowResponse> logout(HttpServletResponse response) {
    orchestrator.logout(response);
    return ResponseEntity.ok(FlowResponse.success());
  }
}
