package com.vitalwatch.common.model;

import java.util.List;
import java.util.Optional;

/**
 * Raw store answers for one signal in one cycle: the smoothed short-window series and the
 * long-window point mean.
 *
 * @param signal the signal these readings belong to
 * @param series smoothed short-window samples; null and non-finite entries are dropped, may be empty
 * @param point  long-window mean; empty when the window held no data
 */
public record SignalReadings(
    VitalSignal      signal,
    List<Double>     series,
    Optional<Double> point
) {
    public SignalReadings {
        series = series == null ? List.of() : series.stream()
            .filter(v -> v != null && Double.isFinite(v))
            .toList();
        point  = point == null ? Optional.empty() : point.filter(Double::isFinite);
    }

    public static SignalReadings of(VitalSignal signal, List<Double> series, Optional<Double> point) {
        return new SignalReadings(signal, series, point);
    }

    /** True when neither window produced anything: the signal is silent, not merely short of data. */
    public boolean noRecentData() {
        return point.isEmpty() && series.isEmpty();
    }
}
