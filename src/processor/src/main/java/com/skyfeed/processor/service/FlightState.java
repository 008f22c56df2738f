package com.skyfeed.processor.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One aircraft state vector read from an {@code adsb} batch.
 *
 * <p>Unknown JSON attributes are ignored to keep ingestion resilient to upstream schema drift.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FlightState(
  @JsonProperty("icao24") String icao24,
  @JsonProperty("callsign") String callsign,
  @JsonProperty("origin_country") String originCountry,
  @JsonProperty("latitude") Double latitude,
  @JsonProperty("longitude") Double longitude,
  @JsonProperty("velocity") Double velocity,
  @JsonProperty("heading") Double heading,
  @JsonProperty("vertical_rate") Double verticalRate,
  @JsonProperty("altitude") Double altitude,
  @JsonProperty("geo_altitude") Double geoAltitude,
  @JsonProperty("on_ground") Boolean onGround,
  @JsonProperty("squawk") String squawk,
  @JsonProperty("observed_at") Long observedAt
) {}
