package com.skyfeed.dashboard.model;

/**
 * Region of interest drawn on the map client.
 *
 * @param northEast north-east corner
 * @param southWest south-west corner
 */
public record BoundingBox(Coordinates northEast, Coordinates southWest) {
  /**
   * Computes approximate area in square degrees.
   *
   * @return area in degree-squared units, only meaningful once corners are validated
   */
  public double areaDeg2() {
    return (northEast.lat() - southWest.lat()) * (northEast.lng() - southWest.lng());
  }
}
