package com.skyfeed.processor.snapshot;

import com.skyfeed.processor.service.FlightState;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SQLite implementation of {@link FlightSnapshotRepository}.
 *
 * <p>The repository uses:
 * <ul>
 *   <li>one {@code flight_snapshot} row per ICAO24, WAL journal so readers never block the writer</li>
 *   <li>an insert that ignores existing keys, then an update guarded by
 *       {@code observed_at < ?}, both in autocommit: each write is a per-key compare-and-swap</li>
 *   <li>one connection per batch, so a replaced or recreated file is picked up on the next batch</li>
 * </ul>
 */
public class SqliteFlightSnapshotRepository implements FlightSnapshotRepository {
  private static final Logger LOGGER = LoggerFactory.getLogger(SqliteFlightSnapshotRepository.class);

  private static final String CREATE_TABLE_SQL = "CREATE TABLE IF NOT EXISTS flight_snapshot ("
      + "icao24 TEXT PRIMARY KEY, "
      + "callsign TEXT, "
      + "origin_country TEXT, "
      + "latitude REAL, "
      + "longitude REAL, "
      + "velocity REAL, "
      + "heading REAL, "
      + "vertical_rate REAL, "
      + "altitude REAL, "
      + "geo_altitude REAL, "
      + "on_ground INTEGER, "
      + "squawk TEXT, "
      + "observed_at INTEGER NOT NULL, "
      + "last_updated INTEGER NOT NULL)";
  private static final String CREATE_INDEX_SQL =
      "CREATE INDEX IF NOT EXISTS idx_flight_snapshot_last_updated ON flight_snapshot (last_updated)";

  private static final String INSERT_SQL = "INSERT INTO flight_snapshot ("
      + "callsign, origin_country, latitude, longitude, velocity, heading, vertical_rate, altitude, "
      + "geo_altitude, on_ground, squawk, observed_at, last_updated, icao24) "
      + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) "
      + "ON CONFLICT (icao24) DO NOTHING";
  private static final String UPDATE_IF_NEWER_SQL = "UPDATE flight_snapshot SET "
      + "callsign = ?, origin_country = ?, latitude = ?, longitude = ?, velocity = ?, heading = ?, "
      + "vertical_rate = ?, altitude = ?, geo_altitude = ?, on_ground = ?, squawk = ?, "
      + "observed_at = ?, last_updated = ? "
      + "WHERE icao24 = ? AND observed_at < ?";
  private static final String SELECT_BY_ICAO24_SQL = "SELECT icao24, callsign, origin_country, latitude, "
      + "longitude, velocity, heading, vertical_rate, altitude, geo_altitude, on_ground, squawk, "
      + "observed_at, last_updated FROM flight_snapshot WHERE icao24 = ?";

  private final String url;
  private final int busyTimeoutMs;

  /**
   * Creates the repository and the schema if the file is new.
   *
   * @param sqlitePath path to the SQLite file, parent directories are created
   * @param busyTimeoutMs how long a write waits for a lock held by a reader
   */
  public SqliteFlightSnapshotRepository(Path sqlitePath, int busyTimeoutMs) {
    Path absolute = sqlitePath.toAbsolutePath();
    this.url = "jdbc:sqlite:" + absolute;
    this.busyTimeoutMs = Math.max(0, busyTimeoutMs);
    try {
      if (absolute.getParent() != null) {
        Files.createDirectories(absolute.getParent());
      }
    } catch (Exception ex) {
      throw new SnapshotStoreException("Failed to create snapshot DB directory for " + absolute, ex);
    }
    try (Connection connection = open(); Statement stmt = connection.createStatement()) {
      stmt.execute("PRAGMA journal_mode=WAL");
      stmt.execute(CREATE_TABLE_SQL);
      stmt.execute(CREATE_INDEX_SQL);
    } catch (SQLException ex) {
      throw new SnapshotStoreException("Failed to initialize snapshot DB at " + absolute, ex);
    }
    LOGGER.info("Flight snapshot store ready at {}", absolute);
  }

  @Override
  public List<UpsertOutcome> upsertAll(List<FlightState> states, long lastUpdated) {
    List<UpsertOutcome> outcomes = new ArrayList<>(states.size());
    try (Connection connection = open();
         PreparedStatement insert = connection.prepareStatement(INSERT_SQL);
         PreparedStatement update = connection.prepareStatement(UPDATE_IF_NEWER_SQL)) {
      for (FlightState state : states) {
        outcomes.add(upsert(insert, update, state, lastUpdated));
      }
    } catch (SQLException ex) {
      throw new SnapshotStoreException("Failed to open snapshot DB " + url, ex);
    }
    return outcomes;
  }

  @Override
  public Optional<FlightSnapshot> findByIcao24(String icao24) {
    if (icao24 == null || icao24.isBlank()) {
      return Optional.empty();
    }
    try (Connection connection = open();
         PreparedStatement stmt = connection.prepareStatement(SELECT_BY_ICAO24_SQL)) {
      stmt.setString(1, icao24.trim().toLowerCase(Locale.ROOT));
      try (ResultSet rs = stmt.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        FlightState state = new FlightState(
            rs.getString("icao24"),
            rs.getString("callsign"),
            rs.getString("origin_country"),
            readDouble(rs, "latitude"),
            readDouble(rs, "longitude"),
            readDouble(rs, "velocity"),
            readDouble(rs, "heading"),
            readDouble(rs, "vertical_rate"),
            readDouble(rs, "altitude"),
            readDouble(rs, "geo_altitude"),
            readBoolean(rs, "on_ground"),
            rs.getString("squawk"),
            rs.getLong("observed_at"));
        return Optional.of(new FlightSnapshot(state, rs.getLong("last_updated")));
      }
    } catch (SQLException ex) {
      throw new SnapshotStoreException("Failed to read snapshot entry " + icao24, ex);
    }
  }

  private UpsertOutcome upsert(
      PreparedStatement insert, PreparedStatement update, FlightState state, long lastUpdated) {
    try {
      bindState(insert, state, lastUpdated);
      if (insert.executeUpdate() == 1) {
        return UpsertOutcome.INSERTED;
      }
      bindState(update, state, lastUpdated);
      update.setLong(15, state.observedAt());
      return update.executeUpdate() == 1 ? UpsertOutcome.UPDATED : UpsertOutcome.STALE;
    } catch (SQLException ex) {
      LOGGER.warn("Failed to upsert snapshot entry for {}: {}", state.icao24(), ex.getMessage());
      return UpsertOutcome.FAILED;
    }
  }

  // Column order shared by INSERT_SQL and UPDATE_IF_NEWER_SQL; icao24 comes last in both.
  private static void bindState(PreparedStatement stmt, FlightState state, long lastUpdated) throws SQLException {
    stmt.setString(1, state.callsign());
    stmt.setString(2, state.originCountry());
    setDouble(stmt, 3, state.latitude());
    setDouble(stmt, 4, state.longitude());
    setDouble(stmt, 5, state.velocity());
    setDouble(stmt, 6, state.heading());
    setDouble(stmt, 7, state.verticalRate());
    setDouble(stmt, 8, state.altitude());
    setDouble(stmt, 9, state.geoAltitude());
    if (state.onGround() == null) {
      stmt.setNull(10, Types.INTEGER);
    } else {
      stmt.setInt(10, state.onGround() ? 1 : 0);
    }
    stmt.setString(11, state.squawk());
    stmt.setLong(12, state.observedAt());
    stmt.setLong(13, lastUpdated);
    stmt.setString(14, state.icao24());
  }

  private static void setDouble(PreparedStatement stmt, int index, Double value) throws SQLException {
    if (value == null) {
      stmt.setNull(index, Types.REAL);
    } else {
      stmt.setDouble(index, value);
    }
  }

  private Connection open() throws SQLException {
    Connection connection = DriverManager.getConnection(url);
    try (Statement stmt = connection.createStatement()) {
      stmt.execute("PRAGMA busy_timeout=" + busyTimeoutMs);
    } catch (SQLException ex) {
      connection.close();
      throw ex;
    }
    return connection;
  }

  private static Double readDouble(ResultSet rs, String column) throws SQLException {
    double value = rs.getDouble(column);
    return rs.wasNull() ? null : value;
  }

  private static Boolean readBoolean(ResultSet rs, String column) throws SQLException {
    int value = rs.getInt(column);
    return rs.wasNull() ? null : value != 0;
  }
}
