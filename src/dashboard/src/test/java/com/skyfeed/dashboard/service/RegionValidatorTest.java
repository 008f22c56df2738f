package com.skyfeed.dashboard.service;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.skyfeed.dashboard.api.BadRequestException;
import com.skyfeed.dashboard.config.DashboardProperties;
import com.skyfeed.dashboard.model.BoundingBox;
import com.skyfeed.dashboard.model.Coordinates;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RegionValidatorTest {
  private DashboardProperties.Regions limits;

  @BeforeEach
  void setUp() {
    limits = new DashboardProperties.Regions();
    limits.setMaxCount(2);
    limits.setMaxAreaDeg2(100.0);
  }

  private static BoundingBox box(Double neLat, Double neLng, Double swLat, Double swLng) {
    return new BoundingBox(new Coordinates(neLat, neLng), new Coordinates(swLat, swLng));
  }

  @Test
  void acceptsWellFormedBoxes() {
    assertThatCode(() -> RegionValidator.validate(
        List.of(box(50.0, 10.0, 45.0, 0.0), box(-10.0, -170.0, -20.0, -179.0)), limits))
        .doesNotThrowAnyException();
  }

  @Test
  void rejectsNullAndEmptyLists() {
    assertThatThrownBy(() -> RegionValidator.validate(null, limits))
        .isInstanceOf(BadRequestException.class);
    assertThatThrownBy(() -> RegionValidator.validate(Collections.emptyList(), limits))
        .isInstanceOf(BadRequestException.class);
  }

  @Test
  void rejectsTooManyBoxes() {
    BoundingBox ok = box(50.0, 10.0, 45.0, 0.0);
    assertThatThrownBy(() -> RegionValidator.validate(List.of(ok, ok, ok), limits))
        .isInstanceOf(BadRequestException.class)
        .hasMessageContaining("at most 2");
  }

  @Test
  void rejectsMissingCorner() {
    assertThatThrownBy(() -> RegionValidator.validate(
        List.of(new BoundingBox(null, new Coordinates(45.0, 0.0))), limits))
        .isInstanceOf(BadRequestException.class)
        .hasMessageContaining("northEast");
    assertThatThrownBy(() -> RegionValidator.validate(List.of(box(50.0, null, 45.0, 0.0)), limits))
        .isInstanceOf(BadRequestException.class);
  }

  @Test
  void rejectsOutOfRangeCoordinates() {
    assertThatThrownBy(() -> RegionValidator.validate(List.of(box(91.0, 10.0, 85.0, 0.0)), limits))
        .isInstanceOf(BadRequestException.class)
        .hasMessageContaining("[-90,90]");
    assertThatThrownBy(() -> RegionValidator.validate(List.of(box(50.0, 181.0, 45.0, 175.0)), limits))
        .isInstanceOf(BadRequestException.class)
        .hasMessageContaining("[-180,180]");
  }

  @Test
  void rejectsInvertedOrDegenerateBoxes() {
    assertThatThrownBy(() -> RegionValidator.validate(List.of(box(45.0, 10.0, 50.0, 0.0)), limits))
        .isInstanceOf(BadRequestException.class)
        .hasMessageContaining("northEast.lat");
    assertThatThrownBy(() -> RegionValidator.validate(List.of(box(50.0, 0.0, 45.0, 0.0)), limits))
        .isInstanceOf(BadRequestException.class)
        .hasMessageContaining("northEast.lng");
  }

  @Test
  void rejectsOversizedArea() {
    assertThatThrownBy(() -> RegionValidator.validate(List.of(box(60.0, 20.0, 40.0, 0.0)), limits))
        .isInstanceOf(BadRequestException.class)
        .hasMessageContaining("exceeds maximum");
  }

  @Test
  void errorNamesTheOffendingIndex() {
    assertThatThrownBy(() -> RegionValidator.validate(
        List.of(box(50.0, 10.0, 45.0, 0.0), box(40.0, 10.0, 45.0, 0.0)), limits))
        .hasMessageStartingWith("boundingBoxes[1]");
  }
}
