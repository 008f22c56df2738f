package com.skyfeed.dashboard;

import com.skyfeed.dashboard.config.DashboardProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main Spring Boot entrypoint for the SkyFeed query API service.
 *
 * <p>The application serves the fresh part of the flight snapshot and accepts region submissions
 * that are handed to the ingester through the {@code regions} queue.
 */
@SpringBootApplication
@EnableConfigurationProperties(DashboardProperties.class)
public class DashboardApplication {
  /**
   * Starts the dashboard API application.
   *
   * @param args standard Spring Boot startup arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(DashboardApplication.class, args);
  }
}
