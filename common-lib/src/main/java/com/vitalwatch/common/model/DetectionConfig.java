package com.vitalwatch.common.model;

/**
 * Judgment parameters shared by every cycle: per-signal thresholds, the consecutive-anomaly
 * trigger and the trimmed-mean window size.
 */
public record DetectionConfig(
    SignalThresholds heartRate,
    SignalThresholds respiration,
    int              triggerThreshold,
    int              trimWindow
) {
    public static final int DEFAULT_TRIGGER_THRESHOLD = 3;
    public static final int DEFAULT_TRIM_WINDOW       = 10;

    public DetectionConfig {
        if (heartRate == null || respiration == null) {
            throw new IllegalArgumentException("thresholds are required for both signals");
        }
        if (triggerThreshold < 1) {
            throw new IllegalArgumentException("triggerThreshold must be >= 1, got " + triggerThreshold);
        }
        if (trimWindow < 1) {
            throw new IllegalArgumentException("trimWindow must be >= 1, got " + trimWindow);
        }
    }

    /** HR 20 bpm / 30 %, RR 5 rpm / 35 %, three consecutive cycles, ten-sample trimmed window. */
    public static DetectionConfig defaults() {
        return new DetectionConfig(
            SignalThresholds.of(20, 0.30),
            SignalThresholds.of(5, 0.35),
            DEFAULT_TRIGGER_THRESHOLD,
            DEFAULT_TRIM_WINDOW);
    }

    public SignalThresholds thresholds(VitalSignal signal) {
        return switch (signal) {
            case HEART_RATE  -> heartRate;
            case RESPIRATION -> respiration;
        };
    }
}
