package com.vitalwatch.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Deviation limits for one signal. A cycle is anomalous when the absolute swing exceeds
 * {@code absThreshold} or the swing relative to the long-window value exceeds {@code relThreshold}.
 */
public record SignalThresholds(
    @JsonProperty("absThreshold") double absThreshold,
    @JsonProperty("relThreshold") double relThreshold
) {
    public SignalThresholds {
        if (absThreshold < 0 || relThreshold < 0) {
            throw new IllegalArgumentException(
                "thresholds must be non-negative: abs=" + absThreshold + " rel=" + relThreshold);
        }
    }

    public static SignalThresholds of(double absThreshold, double relThreshold) {
        return new SignalThresholds(absThreshold, relThreshold);
    }
}
