package com.skyfeed.ingester.opensky;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One aircraft state vector as published on the {@code adsb} queue.
 *
 * <p>{@code observedAt} is the upstream contact time (epoch seconds), never the arrival time.
 * {@code altitude} is barometric, {@code geoAltitude} geometric, both in metres.
 */
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
    @JsonProperty("observed_at") Long observedAt) {}
