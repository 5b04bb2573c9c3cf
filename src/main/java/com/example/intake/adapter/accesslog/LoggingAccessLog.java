package com.example.intake.adapter.accesslog;

import com.example.intake.util.LogMasking;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Writes lead events to the application log only. Used when no lead back end is configured.
 */
@Slf4j
public class LoggingAccessLog implements AccessLog {

  @Override
  public void record(AccessEventKind kind, Map<String, Object> fields) {
    log.info("Access event {}: {}", kind, LogMasking.maskContactDetails(LogMasking.redact(fields)));
  }
}
