package com.vitalwatch.detector.store;

import java.time.Duration;

/**
 * Shape of the smoothed short-window query: how far back to look, and the
 * {@code timedMovingAverage(every, period)} smoothing applied to the raw samples.
 */
public record SeriesWindow(
    Duration lookback,
    Duration every,
    Duration period
) {
    /** 12 hours of a 10-minute moving average emitted every 5 minutes. */
    public static SeriesWindow defaults() {
        return new SeriesWindow(Duration.ofHours(12), Duration.ofMinutes(5), Duration.ofMinutes(10));
    }
}
