package com.skyfeed.processor.snapshot;

import com.skyfeed.processor.config.ProcessorProperties;
import java.nio.file.Path;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Spring configuration for the SQLite-backed flight snapshot store. */
@Configuration
public class SnapshotDbConfig {

  /**
   * Creates the snapshot repository on {@code processor.snapshot-db.path}.
   *
   * @param properties processor configuration properties
   * @return repository backed by the local SQLite file
   */
  @Bean
  public FlightSnapshotRepository flightSnapshotRepository(ProcessorProperties properties) {
    String path = properties.getSnapshotDb().getPath();
    if (path == null || path.isBlank()) {
      throw new IllegalStateException("processor.snapshot-db.path is empty");
    }
    return new SqliteFlightSnapshotRepository(Path.of(path), properties.getSnapshotDb().getBusyTimeoutMs());
  }
}
