package com.skyfeed.dashboard.service;

import com.skyfeed.dashboard.api.BadRequestException;
import com.skyfeed.dashboard.config.DashboardProperties;
import com.skyfeed.dashboard.model.BoundingBox;
import com.skyfeed.dashboard.model.Coordinates;
import java.util.List;
import java.util.Locale;

/**
 * Utility class validating submitted regions of interest.
 *
 * <p>All checks throw {@link BadRequestException}, so nothing is queued for an invalid submission.
 */
public final class RegionValidator {

  private RegionValidator() {}

  /**
   * Validates a whole submission against the configured region limits.
   *
   * @param boxes submitted bounding boxes, possibly {@code null}
   * @param limits configured count and area limits
   */
  public static void validate(List<BoundingBox> boxes, DashboardProperties.Regions limits) {
    if (boxes == null || boxes.isEmpty()) {
      throw new BadRequestException("boundingBoxes must contain at least one region");
    }
    if (boxes.size() > limits.getMaxCount()) {
      throw new BadRequestException("at most " + limits.getMaxCount() + " regions per submission");
    }
    for (int i = 0; i < boxes.size(); i++) {
      validateBox(i, boxes.get(i), limits.getMaxAreaDeg2());
    }
  }

  static void validateBox(int index, BoundingBox box, double maxAreaDeg2) {
    String prefix = "boundingBoxes[" + index + "]: ";
    if (box == null) {
      throw new BadRequestException(prefix + "region must not be null");
    }
    validateCorner(prefix + "northEast", box.northEast());
    validateCorner(prefix + "southWest", box.southWest());

    if (box.northEast().lat() <= box.southWest().lat()) {
      throw new BadRequestException(prefix + "northEast.lat must be greater than southWest.lat");
    }
    if (box.northEast().lng() <= box.southWest().lng()) {
      throw new BadRequestException(prefix + "northEast.lng must be greater than southWest.lng");
    }

    double area = box.areaDeg2();
    if (area > maxAreaDeg2) {
      throw new BadRequestException(String.format(Locale.ROOT,
          "%sarea %.1f deg2 exceeds maximum %.1f deg2", prefix, area, maxAreaDeg2));
    }
  }

  private static void validateCorner(String name, Coordinates corner) {
    if (corner == null || corner.lat() == null || corner.lng() == null) {
      throw new BadRequestException(name + " requires lat and lng");
    }
    if (!Double.isFinite(corner.lat()) || corner.lat() < -90 || corner.lat() > 90) {
      throw new BadRequestException(name + ".lat must be within [-90,90]");
    }
    if (!Double.isFinite(corner.lng()) || corner.lng() < -180 || corner.lng() > 180) {
      throw new BadRequestException(name + ".lng must be within [-180,180]");
    }
  }
}
