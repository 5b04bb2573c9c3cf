package com.example.intake.adapter.accesslog;

import java.util.Map;

/**
 * Best-effort telemetry sink for lead events. Implementations return immediately and never throw;
 * a lost event must not affect the authentication flow.
 */
public interface AccessLog {

  void record(AccessEventKind kind, Map<String, Object> fields);
}
