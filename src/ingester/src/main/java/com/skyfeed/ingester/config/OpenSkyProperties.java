package com.skyfeed.ingester.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "opensky")
public record OpenSkyProperties(
    String baseUrl,
    String tokenUrl,
    String clientId,
    String clientSecret,
    String clientIdSsm,
    String clientSecretSsm,
    long connectTimeoutMs,
    long requestTimeoutMs) {
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

  public Duration connectTimeout() {
    return connectTimeoutMs > 0 ? Duration.ofMillis(connectTimeoutMs) : DEFAULT_TIMEOUT;
  }

  public Duration requestTimeout() {
    return requestTimeoutMs > 0 ? Duration.ofMillis(requestTimeoutMs) : DEFAULT_TIMEOUT;
  }
}
