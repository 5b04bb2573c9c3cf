package com.example.intake.web.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body of every programmatic flow step: {@code {ok:true}} or {@code {ok:false, error}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlowResponse(boolean ok, String requestId, String error) {

  public static FlowResponse success() {
    return new FlowResponse(true, null, null);
  }

  public static FlowResponse success(String requestId) {
    return new FlowResponse(true, requestId, null);
  }

  public static FlowResponse failure(String error) {
    return new FlowResponse(false, null, error);
  }
}
