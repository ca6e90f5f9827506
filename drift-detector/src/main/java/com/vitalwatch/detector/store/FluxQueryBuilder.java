package com.vitalwatch.detector.store;

import java.time.Duration;

/**
 * Builds the two Flux scripts a detection cycle runs against InfluxDB.
 *
 * <p>Both scripts drop zero readings, which the sensor emits when it has no lock on the
 * subject. The series script drops zeros again after smoothing because
 * {@code timedMovingAverage} emits {@code 0} for empty periods.
 */
public final class FluxQueryBuilder {

    private FluxQueryBuilder() {}

    public static String series(String bucket, String deviceId, String field, SeriesWindow window) {
        return String.format("""
            from(bucket: "%s")
              |> range(start: -%s)
              |> filter(fn: (r) => r["device_id"] == "%s")
              |> filter(fn: (r) => r["_field"] == "%s")
              |> filter(fn: (r) => r._value != 0)
              |> timedMovingAverage(every: %s, period: %s)
              |> filter(fn: (r) => r._value != 0)""",
            escape(bucket), fluxDuration(window.lookback()), escape(deviceId), escape(field),
            fluxDuration(window.every()), fluxDuration(window.period()));
    }

    public static String mean(String bucket, String deviceId, String field, PointWindow window) {
        return String.format("""
            from(bucket: "%s")
              |> range(start: -%s)
              |> filter(fn: (r) => r["device_id"] == "%s")
              |> filter(fn: (r) => r["_field"] == "%s")
              |> filter(fn: (r) => r._value != 0)
              |> mean()""",
            escape(bucket), fluxDuration(window.lookback()), escape(deviceId), escape(field));
    }

    /** Renders a duration as a Flux duration literal using the largest exact unit (h, m or s). */
    static String fluxDuration(Duration duration) {
        if (duration.getSeconds() < 1) {
            throw new IllegalArgumentException("Flux window must be at least one second, got " + duration);
        }
        long seconds = duration.getSeconds();
        if (seconds % 3600 == 0) return (seconds / 3600) + "h";
        if (seconds % 60 == 0)   return (seconds / 60) + "m";
        return seconds + "s";
    }

    /** Escapes a value for use inside a Flux string literal. */
    static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
