package com.skyfeed.processor.service;

/** Per-batch tally of what happened to each element of one {@code adsb} message. */
public record BatchResult(int inserted, int updated, int stale, int failed, int malformed) {
  public static final BatchResult DROPPED = new BatchResult(0, 0, 0, 0, 0);

  public int total() {
    return inserted + updated + stale + failed + malformed;
  }
}
