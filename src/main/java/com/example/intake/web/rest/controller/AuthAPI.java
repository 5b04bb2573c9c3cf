package com.example.intake.web.rest.controller;

import static com.example.intake.web.rest.ApiConstants.ApiPath.*;

import com.example.intake.web.rest.dto.FlowResponse;
import com.example.intake.web.rest.dto.MagicLinkRequest;
import com.example.intake.web.rest.dto.OtpRequest;
import com.example.intake.web.rest.dto.OtpVerification;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Tag(
    name = "Authentication",
    description = "Two-factor flow: email magic link, then SMS one-time code"
)
@RequestMapping(
    value = AUTH_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface AuthAPI {

  @Operation(
      summary = "Request a magic link",
      description = "Emails a login-or-signup magic link. Sets no cookie."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Link sent"),
      @ApiResponse(responseCode = "400", description = "Invalid email"),
      @ApiResponse(responseCode = "500", description = "Identity provider failure")
  })
  @PostMapping(value = LINK_REQUEST, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<FlowResponse> requestLink(
      @RequestBody MagicLinkRequest body,
      HttpServletRequest request
                                          );

  @Operation(
      summary = "Consume a magic link",
      description = "Target of the emailed link. Sets the primary session cookie and redirects "
          + "to the second-factor page, or redirects to the entry point with a reason code"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "302", description = "Redirect to second factor or entry point")
  })
  @GetMapping(value = LINK_CONSUME)
  ResponseEntity<Void> consumeLink(
      @Parameter(description = "Token embedded in the emailed link")
      @RequestParam(required = false) String token,
      HttpServletResponse response
                                  );

  @Operation(
      summary = "Request an SMS code",
      description = "Sends a one-time code and sets the phone challenge cookie"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Code sent"),
      @ApiResponse(responseCode = "400", description = "Invalid phone or no active session"),
      @ApiResponse(responseCode = "500", description = "Identity provider failure")
  })
  @PostMapping(value = OTP_REQUEST, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<FlowResponse> requestOtp(
      @RequestBody OtpRequest body,
      HttpServletRequest request,
      HttpServletResponse response
                                         );

  @Operation(
      summary = "Verify an SMS code",
      description = "Sets the step-up credential cookie and clears the phone challenge"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Second factor complete"),
      @ApiResponse(responseCode = "400", description = "Invalid code or expired challenge"),
      @ApiResponse(responseCode = "500", description = "Identity provider failure")
  })
  @PostMapping(value = OTP_CONSUME, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<FlowResponse> consumeOtp(
      @RequestBody OtpVerification body,
      HttpServletRequest request,
      HttpServletResponse response
                                         );

  @Operation(
      summary = "Flow status",
      description = "Where this browser stands in the flow, derived from its cookies"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Status returned")
  })
  @GetMapping(value = STATUS)
  ResponseEntity<Map<String, Object>> status(HttpServletRequest request);

  @Operation(
      summary = "Logout",
      description = "Clears every flow cookie"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Cookies cleared")
  })
  @PostMapping(value = LOGOUT)
  ResponseEntity<FlowResponse> logout(HttpServletResponse response);
}
