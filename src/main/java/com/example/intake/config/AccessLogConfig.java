package com.example.intake.config;

import com.example.intake.adapter.accesslog.AccessLog;
import com.example.intake.adapter.accesslog.HttpAccessLog;
import com.example.intake.adapter.accesslog.LoggingAccessLog;
import com.example.intake.properties.ApplicationProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Picks the access log sink once at startup.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class AccessLogConfig {

  @Bean
  public AccessLog accessLog(ApplicationProperties properties,
                             @Qualifier("accessLogOkHttpClient") OkHttpClient httpClient,
                             ObjectMapper objectMapper) {
    if (properties.accessLog().enabled()) {
      log.info("Access events delivered to {}", properties.accessLog().url());
      return new HttpAccessLog(properties.accessLog().url(), httpClient, objectMapper);
    }
    log.info("No lead back end configured; access events go to the application log only");
    return new LoggingAccessLog();
  }
}
