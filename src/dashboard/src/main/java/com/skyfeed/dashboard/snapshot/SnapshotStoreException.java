package com.skyfeed.dashboard.snapshot;

public class SnapshotStoreException extends RuntimeException {
  public SnapshotStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
