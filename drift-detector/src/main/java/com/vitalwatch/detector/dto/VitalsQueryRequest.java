package com.vitalwatch.detector.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /api/v1/vitals/query}. Either a raw Flux {@code query}, or a {@code field}
 * plus a canned {@code mode} ({@code tma2m} smoothed series, {@code mean5m} point mean).
 * {@code bucket} and {@code deviceId} fall back to the configured defaults.
 */
public record VitalsQueryRequest(
    @JsonProperty("query")    String query,
    @JsonProperty("field")    String field,
    @JsonProperty("mode")     String mode,
    @JsonProperty("bucket")   String bucket,
    @JsonProperty("deviceId") String deviceId
) {}
