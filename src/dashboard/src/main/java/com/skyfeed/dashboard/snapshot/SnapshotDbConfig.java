package com.skyfeed.dashboard.snapshot;

import com.skyfeed.dashboard.config.DashboardProperties;
import java.nio.file.Path;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Spring configuration for read access to the processor's flight snapshot. */
@Configuration
public class SnapshotDbConfig {

  /**
   * Creates the snapshot reader on {@code dashboard.snapshot-db.path}.
   *
   * @param properties dashboard configuration properties
   * @return read-only reader backed by the shared SQLite file
   */
  @Bean
  public FlightSnapshotReader flightSnapshotReader(DashboardProperties properties) {
    String path = properties.getSnapshotDb().getPath();
    if (path == null || path.isBlank()) {
      throw new IllegalStateException("dashboard.snapshot-db.path is empty");
    }
    return new SqliteFlightSnapshotReader(Path.of(path));
  }
}
