package com.skyfeed.dashboard.model;

/** Payload of {@code GET /}. */
public record ServiceInfoResponse(String name, String version) {}
