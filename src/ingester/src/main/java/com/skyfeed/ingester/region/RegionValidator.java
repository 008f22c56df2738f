package com.skyfeed.ingester.region;

/**
 * Well-formedness checks applied before a region reaches the {@link RegionRegistry}.
 *
 * <p>Boxes crossing the anti-meridian are rejected: the north-east corner must be strictly north
 * and strictly east of the south-west corner.
 */
public final class RegionValidator {
  private RegionValidator() {}

  public static Region validate(Region region) {
    if (region == null) {
      throw new InvalidRegionException("region payload is empty");
    }
    if (region.id() == null || region.id().isBlank()) {
      throw new InvalidRegionException("region id is missing");
    }
    if (region.northEastLat() == null
        || region.northEastLon() == null
        || region.southWestLat() == null
        || region.southWestLon() == null) {
      throw new InvalidRegionException("region " + region.id() + " is missing a corner coordinate");
    }
    requireInRange("north_east_lat", region.northEastLat(), -90.0, 90.0);
    requireInRange("south_west_lat", region.southWestLat(), -90.0, 90.0);
    requireInRange("north_east_lon", region.northEastLon(), -180.0, 180.0);
    requireInRange("south_west_lon", region.southWestLon(), -180.0, 180.0);
    if (region.northEastLat() <= region.southWestLat()) {
      throw new InvalidRegionException("north_east_lat must be greater than south_west_lat");
    }
    if (region.northEastLon() <= region.southWestLon()) {
      throw new InvalidRegionException("north_east_lon must be greater than south_west_lon");
    }
    return region;
  }

  private static void requireInRange(String field, double value, double min, double max) {
    if (Double.isNaN(value) || value < min || value > max) {
      throw new InvalidRegionException(field + " must be within [" + min + "," + max + "]");
    }
  }
}
