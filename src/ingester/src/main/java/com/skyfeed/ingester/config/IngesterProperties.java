package com.skyfeed.ingester.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ingester")
public record IngesterProperties(
    long refreshMs,
    Queues queues,
    Backoff backoff,
    Publish publish,
    Bbox bootstrapRegion,
    RateLimit rateLimit) {
  public record Queues(
      String regionsKey,
      String adsbKey,
      String processingSuffix,
      long pollTimeoutSeconds,
      long reconnectInitialMs,
      long reconnectMaxMs) {}

  // Applied on HTTP 429: delay is multiplied on every rate-limited cycle, capped at maxRefreshMs.
  public record Backoff(double multiplier, long maxRefreshMs) {}

  public record Publish(int maxAttempts, long initialBackoffMs, long maxBackoffMs) {}

  public record Bbox(double latMin, double latMax, double lonMin, double lonMax) {}

  public record RateLimit(
      long quota,
      int warn50,
      int warn80,
      int warn95,
      long refreshWarnMs,
      long refreshCriticalMs) {}
}
