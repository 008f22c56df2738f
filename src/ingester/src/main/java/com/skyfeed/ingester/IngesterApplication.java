package com.skyfeed.ingester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class IngesterApplication {
  // Main entrypoint: boots Spring; the poller and region ingestor loops start with the context.
  public static void main(String[] args) {
    SpringApplication.run(IngesterApplication.class, args);
  }
}
