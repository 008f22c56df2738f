package com.skyfeed.processor.snapshot;

import com.skyfeed.processor.service.FlightState;
import java.util.List;
import java.util.Optional;

/** Durable current-state view keyed by ICAO24. */
public interface FlightSnapshotRepository {
  /**
   * Folds a batch into the snapshot, one independent conditional write per state.
   *
   * <p>A state is written when no entry exists for its aircraft or when its {@code observedAt}
   * is strictly newer than the stored one. A failure on one state does not stop the others.
   *
   * @param states validated states, {@code icao24} already normalized
   * @param lastUpdated arrival time in epoch milliseconds, stored with every written entry
   * @return one outcome per input state, in input order
   * @throws SnapshotStoreException when the store cannot be opened at all
   */
  List<UpsertOutcome> upsertAll(List<FlightState> states, long lastUpdated);

  /**
   * Returns the stored entry for one aircraft.
   *
   * @param icao24 aircraft ICAO24 (hex, case-insensitive)
   */
  Optional<FlightSnapshot> findByIcao24(String icao24);
}
