package com.skyfeed.ingester.region;

/** Raised when a region message cannot be applied to the registry. */
public class InvalidRegionException extends RuntimeException {
  public InvalidRegionException(String message) {
    super(message);
  }
}
