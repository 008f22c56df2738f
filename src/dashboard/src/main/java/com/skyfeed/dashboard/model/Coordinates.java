package com.skyfeed.dashboard.model;

/**
 * Map corner as sent by the client.
 *
 * @param lat latitude in decimal degrees
 * @param lng longitude in decimal degrees
 */
public record Coordinates(Double lat, Double lng) {}
