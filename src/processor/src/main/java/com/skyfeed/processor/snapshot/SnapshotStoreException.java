package com.skyfeed.processor.snapshot;

public class SnapshotStoreException extends RuntimeException {
  public SnapshotStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
