package com.skyfeed.ingester;

/** Phases of one poll cycle, exported as the {@code ingester.poller.state} gauge (ordinal). */
public enum PollerState {
  IDLE,
  FETCHING,
  PUBLISHING,
  SLEEPING
}
