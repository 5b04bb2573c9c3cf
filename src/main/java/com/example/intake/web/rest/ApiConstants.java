package com.example.intake.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String AUTH_BASE = "/auth";
    public static final String APP_BASE = "/app";
    public static final String HEALTH_BASE = "/health";

    // Auth paths
    public static final String LINK_REQUEST = "/link/request";
    public static final String LINK_CONSUME = "/link/consume";
    public static final String OTP_REQUEST = "/otp/request";
    public static final String OTP_CONSUME = "/otp/consume";
    public static final String LOGOUT = "/logout";
    public static final String STATUS = "/status";

    // Protected paths
    public static final String ME = "/me";


    private ApiPath() {}
  }

  private ApiConstants() {}
}
