package com.skyfeed.dashboard.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration container for the dashboard API service.
 *
 * <p>Values are bound from {@code dashboard.*} in {@code application.yml} and environment
 * variables.
 */
@ConfigurationProperties(prefix = "dashboard")
public class DashboardProperties {
  private String version = "0.1.0";
  private final Redis redis = new Redis();
  private final SnapshotDb snapshotDb = new SnapshotDb();
  private final Api api = new Api();

  public String getVersion() {
    return version;
  }

  public void setVersion(String version) {
    this.version = version;
  }

  public Redis getRedis() {
    return redis;
  }

  public SnapshotDb getSnapshotDb() {
    return snapshotDb;
  }

  public Api getApi() {
    return api;
  }

  /** Redis key and retry configuration used by the region submission path. */
  public static class Redis {
    private String regionsKey = "skyfeed:queue:regions";
    private final Publish publish = new Publish();

    public String getRegionsKey() {
      return regionsKey;
    }

    public void setRegionsKey(String regionsKey) {
      this.regionsKey = regionsKey;
    }

    public Publish getPublish() {
      return publish;
    }
  }

  /** Bounded doubling retry applied to the {@code regions} push. */
  public static class Publish {
    private int maxAttempts = 3;
    private long initialBackoffMs = 200;
    private long maxBackoffMs = 2000;

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public long getInitialBackoffMs() {
      return initialBackoffMs;
    }

    public void setInitialBackoffMs(long initialBackoffMs) {
      this.initialBackoffMs = initialBackoffMs;
    }

    public long getMaxBackoffMs() {
      return maxBackoffMs;
    }

    public void setMaxBackoffMs(long maxBackoffMs) {
      this.maxBackoffMs = maxBackoffMs;
    }
  }

  /** SQLite snapshot file written by the processor, opened read-only here. */
  public static class SnapshotDb {
    private String path = "data/flight-snapshot.db";

    public String getPath() {
      return path;
    }

    public void setPath(String path) {
      this.path = path;
    }
  }

  /** API-level behavior configuration (freshness, region limits, CORS, rate limits). */
  public static class Api {
    private Duration freshnessWindow = Duration.ofSeconds(60);
    private final Regions regions = new Regions();
    private final Cors cors = new Cors();
    private final RateLimit rateLimit = new RateLimit();

    public Duration getFreshnessWindow() {
      return freshnessWindow;
    }

    public void setFreshnessWindow(Duration freshnessWindow) {
      this.freshnessWindow = freshnessWindow;
    }

    public Regions getRegions() {
      return regions;
    }

    public Cors getCors() {
      return cors;
    }

    public RateLimit getRateLimit() {
      return rateLimit;
    }
  }

  /** Constraints applied to submitted regions of interest. */
  public static class Regions {
    private int maxCount = 10;
    private double maxAreaDeg2 = 2500.0;

    public int getMaxCount() {
      return maxCount;
    }

    public void setMaxCount(int maxCount) {
      this.maxCount = maxCount;
    }

    public double getMaxAreaDeg2() {
      return maxAreaDeg2;
    }

    public void setMaxAreaDeg2(double maxAreaDeg2) {
      this.maxAreaDeg2 = maxAreaDeg2;
    }
  }

  /** CORS allowlist configuration for frontend consumers. */
  public static class Cors {
    private List<String> allowedOrigins = new ArrayList<>();

    public List<String> getAllowedOrigins() {
      return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
      this.allowedOrigins = allowedOrigins;
    }
  }

  /** Rate limiting configuration applied to {@code /api/**} endpoints. */
  public static class RateLimit {
    private int windowSeconds = 60;
    private int maxRequests = 120;

    public int getWindowSeconds() {
      return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
      this.windowSeconds = windowSeconds;
    }

    public int getMaxRequests() {
      return maxRequests;
    }

    public void setMaxRequests(int maxRequests) {
      this.maxRequests = maxRequests;
    }
  }
}
