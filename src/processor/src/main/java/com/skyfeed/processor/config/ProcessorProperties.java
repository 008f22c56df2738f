package com.skyfeed.processor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the processor service.
 *
 * <p>Values are bound from {@code application.yml} and environment variables under the
 * {@code processor.*} prefix.
 */
@ConfigurationProperties(prefix = "processor")
public class ProcessorProperties {
  private final Redis redis = new Redis();
  private final SnapshotDb snapshotDb = new SnapshotDb();
  private long pollTimeoutSeconds = 2;
  private long reconnectInitialMs = 500;
  private long reconnectMaxMs = 30000;

  public Redis getRedis() {
    return redis;
  }

  public SnapshotDb getSnapshotDb() {
    return snapshotDb;
  }

  public long getPollTimeoutSeconds() {
    return pollTimeoutSeconds;
  }

  public void setPollTimeoutSeconds(long pollTimeoutSeconds) {
    this.pollTimeoutSeconds = pollTimeoutSeconds;
  }

  public long getReconnectInitialMs() {
    return reconnectInitialMs;
  }

  public void setReconnectInitialMs(long reconnectInitialMs) {
    this.reconnectInitialMs = reconnectInitialMs;
  }

  public long getReconnectMaxMs() {
    return reconnectMaxMs;
  }

  public void setReconnectMaxMs(long reconnectMaxMs) {
    this.reconnectMaxMs = reconnectMaxMs;
  }

  /** Redis key names used by the processor read path. */
  public static class Redis {
    private String inputKey = "skyfeed:queue:adsb";
    private String processingSuffix = ":processing";

    public String getInputKey() {
      return inputKey;
    }

    public void setInputKey(String inputKey) {
      this.inputKey = inputKey;
    }

    public String getProcessingSuffix() {
      return processingSuffix;
    }

    public void setProcessingSuffix(String processingSuffix) {
      this.processingSuffix = processingSuffix;
    }
  }

  /** SQLite file holding the current flight snapshot. */
  public static class SnapshotDb {
    private String path = "data/flight-snapshot.db";
    private int busyTimeoutMs = 5000;

    public String getPath() {
      return path;
    }

    public void setPath(String path) {
      this.path = path;
    }

    public int getBusyTimeoutMs() {
      return busyTimeoutMs;
    }

    public void setBusyTimeoutMs(int busyTimeoutMs) {
      this.busyTimeoutMs = busyTimeoutMs;
    }
  }
}
