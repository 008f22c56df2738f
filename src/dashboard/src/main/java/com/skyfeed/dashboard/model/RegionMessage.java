package com.skyfeed.dashboard.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One region as published on the {@code regions} queue.
 *
 * @param id server-assigned region identifier
 * @param northEastLat north-east corner latitude
 * @param northEastLon north-east corner longitude
 * @param southWestLat south-west corner latitude
 * @param southWestLon south-west corner longitude
 * @param createdAt ISO-8601 submission instant
 * @param submissionId identifier shared by every region of one submission
 */
public record RegionMessage(
    @JsonProperty("id") String id,
    @JsonProperty("north_east_lat") double northEastLat,
    @JsonProperty("north_east_lon") double northEastLon,
    @JsonProperty("south_west_lat") double southWestLat,
    @JsonProperty("south_west_lon") double southWestLon,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("submission_id") String submissionId) {}
