package com.skyfeed.ingester.region;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Region of interest received on the {@code regions} queue.
 *
 * <p>Coordinates are boxed so that missing attributes can be told apart from {@code 0.0} during
 * validation. Unknown JSON attributes are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Region(
    @JsonProperty("id") String id,
    @JsonProperty("north_east_lat") Double northEastLat,
    @JsonProperty("north_east_lon") Double northEastLon,
    @JsonProperty("south_west_lat") Double southWestLat,
    @JsonProperty("south_west_lon") Double southWestLon,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("submission_id") String submissionId) {

  /** Area in square degrees, used for logging and the active-area gauge. */
  public double areaDeg2() {
    if (northEastLat == null || northEastLon == null || southWestLat == null || southWestLon == null) {
      return 0.0;
    }
    return Math.max(0.0, (northEastLat - southWestLat) * (northEastLon - southWestLon));
  }
}
