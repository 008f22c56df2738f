package com.skyfeed.dashboard.snapshot;

import com.skyfeed.dashboard.model.FlightView;
import java.util.List;

/** Read-only access to the flight snapshot maintained by the processor. */
public interface FlightSnapshotReader {
  /**
   * Returns every entry stored at or after a given instant.
   *
   * @param cutoffEpochMillis lower bound on {@code last_updated}, inclusive
   * @return matching entries, most recently updated first
   * @throws SnapshotStoreException when the store cannot be read
   */
  List<FlightView> findUpdatedSince(long cutoffEpochMillis);
}
