package com.skyfeed.dashboard.service;

import com.skyfeed.dashboard.config.DashboardProperties;
import com.skyfeed.dashboard.model.FlightView;
import com.skyfeed.dashboard.snapshot.FlightSnapshotReader;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/** Serves the fresh part of the flight snapshot. */
@Service
public class FlightQueryService {
  private static final Logger LOGGER = LoggerFactory.getLogger(FlightQueryService.class);

  private final FlightSnapshotReader reader;
  private final DashboardProperties properties;
  private final Clock clock;

  @Autowired
  public FlightQueryService(FlightSnapshotReader reader, DashboardProperties properties) {
    this(reader, properties, Clock.systemUTC());
  }

  FlightQueryService(FlightSnapshotReader reader, DashboardProperties properties, Clock clock) {
    this.reader = reader;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Lists every aircraft stored within the freshness window.
   *
   * <p>Stale entries stay in the store and are filtered here only. A read failure returns an
   * empty list so the map client keeps polling.
   *
   * @return fresh flights, most recently updated first
   */
  public List<FlightView> listFreshFlights() {
    Duration window = properties.getApi().getFreshnessWindow();
    long cutoff = clock.millis() - window.toMillis();
    try {
      return reader.findUpdatedSince(cutoff);
    } catch (RuntimeException ex) {
      LOGGER.warn("Flight snapshot read failed, returning empty list: {}", ex.getMessage());
      LOGGER.debug("Snapshot read failure", ex);
      return List.of();
    }
  }
}
