package com.skyfeed.dashboard.snapshot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.skyfeed.dashboard.model.FlightView;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.sql.Types;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteFlightSnapshotReaderTest {
  @TempDir
  Path tempDir;

  private Path dbPath;

  @BeforeEach
  void createStore() throws Exception {
    dbPath = tempDir.resolve("snapshot.db");
    try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
         Statement stmt = connection.createStatement()) {
      stmt.execute("CREATE TABLE flight_snapshot (icao24 TEXT PRIMARY KEY, callsign TEXT, "
          + "origin_country TEXT, latitude REAL, longitude REAL, velocity REAL, heading REAL, "
          + "vertical_rate REAL, altitude REAL, geo_altitude REAL, on_ground INTEGER, squawk TEXT, "
          + "observed_at INTEGER NOT NULL, last_updated INTEGER NOT NULL)");
    }
  }

  private void insert(String icao24, Double latitude, Boolean onGround, long observedAt, long lastUpdated)
      throws Exception {
    try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
         PreparedStatement stmt = connection.prepareStatement(
             "INSERT INTO flight_snapshot (icao24, callsign, origin_country, latitude, longitude, "
                 + "on_ground, observed_at, last_updated) VALUES (?, ?, ?, ?, ?, ?, ?, ?)")) {
      stmt.setString(1, icao24);
      stmt.setString(2, "CS" + icao24);
      stmt.setString(3, "France");
      if (latitude == null) {
        stmt.setNull(4, Types.REAL);
      } else {
        stmt.setDouble(4, latitude);
      }
      stmt.setDouble(5, 2.0);
      if (onGround == null) {
        stmt.setNull(6, Types.INTEGER);
      } else {
        stmt.setInt(6, onGround ? 1 : 0);
      }
      stmt.setLong(7, observedAt);
      stmt.setLong(8, lastUpdated);
      stmt.executeUpdate();
    }
  }

  @Test
  void findUpdatedSince_excludesStaleRowsWithoutDeletingThem() throws Exception {
    insert("aaa111", 48.0, false, 100L, 10_000L);
    insert("bbb222", 49.0, true, 101L, 20_000L);
    insert("ccc333", 50.0, false, 102L, 30_000L);

    SqliteFlightSnapshotReader reader = new SqliteFlightSnapshotReader(dbPath);

    List<FlightView> fresh = reader.findUpdatedSince(20_000L);
    assertThat(fresh).extracting(FlightView::icao24).containsExactly("ccc333", "bbb222");
    assertThat(fresh.get(1).onGround()).isTrue();

    assertThat(reader.findUpdatedSince(0L)).hasSize(3);
  }

  @Test
  void findUpdatedSince_mapsNullColumnsToNull() throws Exception {
    insert("ddd444", null, null, 100L, 5_000L);

    FlightView view = new SqliteFlightSnapshotReader(dbPath).findUpdatedSince(0L).get(0);

    assertThat(view.latitude()).isNull();
    assertThat(view.onGround()).isNull();
    assertThat(view.velocity()).isNull();
    assertThat(view.longitude()).isEqualTo(2.0);
    assertThat(view.observedAt()).isEqualTo(100L);
    assertThat(view.lastUpdated()).isEqualTo(5_000L);
  }

  @Test
  void findUpdatedSince_missingFileFails() {
    SqliteFlightSnapshotReader reader =
        new SqliteFlightSnapshotReader(tempDir.resolve("absent").resolve("none.db"));

    assertThatThrownBy(() -> reader.findUpdatedSince(0L))
        .isInstanceOf(SnapshotStoreException.class);
  }
}
