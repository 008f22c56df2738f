package com.skyfeed.dashboard.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aircraft projection returned by {@code GET /api/flights}.
 *
 * @param icao24 aircraft identifier
 * @param callsign callsign when available
 * @param originCountry country inferred from the transponder address
 * @param latitude latitude
 * @param longitude longitude
 * @param velocity ground speed in m/s
 * @param heading true track in degrees
 * @param verticalRate vertical rate in m/s
 * @param altitude barometric altitude in metres
 * @param geoAltitude geometric altitude in metres
 * @param onGround whether the aircraft reported surface position
 * @param squawk transponder code
 * @param observedAt upstream contact time (epoch seconds)
 * @param lastUpdated time the processor stored the entry (epoch milliseconds)
 */
public record FlightView(
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
    @JsonProperty("observed_at") long observedAt,
    @JsonProperty("last_updated") long lastUpdated) {}
