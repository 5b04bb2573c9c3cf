package com.example.intake.web.rest.controller;

import static com.example.intake.web.rest.ApiConstants.ApiPath.*;

import com.example.intake.domain.entity.StepUpClaims;
import com.example.intake.web.rest.dto.CurrentIdentityResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;

@Tag(
    name = "Identity",
    description = "Details of the user behind a completed step-up"
)
@RequestMapping(
    value = APP_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface IdentityAPI {

  @Operation(
      summary = "Current identity",
      description = "Subject of the step-up credential with the email and phone known to the "
          + "identity provider"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Identity returned"),
      @ApiResponse(responseCode = "302", description = "No valid step-up credential, redirect to entry point")
  })
  @GetMapping(value = ME)
  ResponseEntity<CurrentIdentityResponse> me(
      @Parameter(hidden = true) @AuthenticationPrincipal StepUpClaims claims,
      HttpServletRequest request
                                            );
}
