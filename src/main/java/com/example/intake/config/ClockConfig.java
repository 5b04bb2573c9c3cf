package com.example.intake.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration(proxyBeanMethods = false)
public class ClockConfig {

  // every credential expiry check reads this clock
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
