package com.skyfeed.processor.snapshot;

/** Result of folding one state vector into the snapshot. */
public enum UpsertOutcome {
  /** No entry existed for the aircraft. */
  INSERTED,
  /** The incoming observation was strictly newer and replaced the stored one. */
  UPDATED,
  /** The stored observation is as new or newer; nothing was written. */
  STALE,
  /** The write failed; the stored entry, if any, is unchanged. */
  FAILED
}
