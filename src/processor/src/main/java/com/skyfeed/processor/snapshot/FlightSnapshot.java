package com.skyfeed.processor.snapshot;

import com.skyfeed.processor.service.FlightState;

/** Stored snapshot entry: the latest state of one aircraft and when the processor wrote it. */
public record FlightSnapshot(FlightState state, long lastUpdated) {}
