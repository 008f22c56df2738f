package com.skyfeed.dashboard.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import java.util.List;

/**
 * Body of {@code POST /api/setregions}.
 *
 * @param boundingBoxes regions replacing the active set, also accepted as {@code bounding_boxes}
 */
public record SetRegionsRequest(@JsonAlias("bounding_boxes") List<BoundingBox> boundingBoxes) {}
