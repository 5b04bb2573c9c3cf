package com.example.intake;

import com.example.intake.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Intake Gateway Application
 *
 * Two-factor gate in front of the lead intake pages:
 * - email magic link as the primary factor
 * - SMS one-time code as the second factor
 * - signed step-up cookie checked on every protected request
 */
@SpringBootApplication
@EnableConfigurationProperties(ApplicationProperties.class)
public class IntakeGatewayApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(IntakeGatewayApplication.class);
    app.setRegisterShutdownHook(true);
    app.run(args);
  }
}
