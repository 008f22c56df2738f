package com.skyfeed.dashboard.snapshot;

import com.skyfeed.dashboard.model.FlightView;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only SQLite implementation of {@link FlightSnapshotReader}.
 *
 * <p>Every call opens its own {@code mode=ro} connection, so the dashboard can start before the
 * processor created the file and picks it up as soon as it exists.
 */
public class SqliteFlightSnapshotReader implements FlightSnapshotReader {
  private static final String SELECT_FRESH_SQL = "SELECT icao24, callsign, origin_country, latitude, "
      + "longitude, velocity, heading, vertical_rate, altitude, geo_altitude, on_ground, squawk, "
      + "observed_at, last_updated FROM flight_snapshot WHERE last_updated >= ? "
      + "ORDER BY last_updated DESC";

  private final String url;

  /**
   * Creates a reader bound to the processor's snapshot file.
   *
   * @param sqlitePath path to the SQLite file, not required to exist yet
   */
  public SqliteFlightSnapshotReader(Path sqlitePath) {
    this.url = "jdbc:sqlite:file:" + sqlitePath.toAbsolutePath() + "?mode=ro";
  }

  @Override
  public List<FlightView> findUpdatedSince(long cutoffEpochMillis) {
    try (Connection connection = DriverManager.getConnection(url);
         PreparedStatement stmt = connection.prepareStatement(SELECT_FRESH_SQL)) {
      stmt.setLong(1, cutoffEpochMillis);
      List<FlightView> flights = new ArrayList<>();
      try (ResultSet rs = stmt.executeQuery()) {
        while (rs.next()) {
          flights.add(new FlightView(
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
              rs.getLong("observed_at"),
              rs.getLong("last_updated")));
        }
      }
      return flights;
    } catch (SQLException ex) {
      throw new SnapshotStoreException("Failed to read flight snapshot from " + url, ex);
    }
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
