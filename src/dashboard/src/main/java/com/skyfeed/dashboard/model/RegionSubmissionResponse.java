package com.skyfeed.dashboard.model;

import java.util.List;

/**
 * Acknowledgement returned by {@code POST /api/setregions}.
 *
 * <p>The regions are queued, not yet active: the ingester applies them on its own schedule.
 *
 * @param message human-readable status
 * @param submissionId identifier shared by the queued regions
 * @param regions queued regions with their assigned ids
 */
public record RegionSubmissionResponse(String message, String submissionId, List<RegionMessage> regions) {}
