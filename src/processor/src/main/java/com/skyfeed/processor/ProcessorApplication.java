package com.skyfeed.processor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Spring Boot entrypoint for the processor service.
 *
 * <p>The processor consumes ADS-B batches from Redis, folds them into the SQLite flight snapshot
 * and exposes operational metrics and health endpoints.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ProcessorApplication {
  /**
   * Starts the processor application.
   *
   * @param args CLI arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(ProcessorApplication.class, args);
  }
}
