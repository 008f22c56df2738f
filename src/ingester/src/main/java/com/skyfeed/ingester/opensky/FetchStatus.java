package com.skyfeed.ingester.opensky;

public enum FetchStatus {
  SUCCESS,
  RATE_LIMITED,
  FAILED
}
