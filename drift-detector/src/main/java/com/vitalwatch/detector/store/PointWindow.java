package com.vitalwatch.detector.store;

import java.time.Duration;

/**
 * Shape of the long-window point query: the mean over the last {@code lookback}.
 */
public record PointWindow(Duration lookback) {

    public static PointWindow defaults() {
        return new PointWindow(Duration.ofMinutes(2));
    }
}
