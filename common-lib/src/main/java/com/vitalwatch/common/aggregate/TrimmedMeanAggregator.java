package com.vitalwatch.common.aggregate;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Reduces a smoothed short-window series to one representative value by averaging a
 * window of {@code n} samples centred on the sorted distribution.
 *
 * <h3>Rule</h3>
 * <ul>
 *   <li>empty series            → no value</li>
 *   <li>{@code L ≤ n}           → mean of all samples</li>
 *   <li>{@code L > n}           → mean of {@code sorted[start, start + n)} with
 *       {@code start = floor((L - n) / 2)}</li>
 * </ul>
 *
 * <p>Both tails are discarded symmetrically (the upper tail keeps the extra sample when
 * {@code L - n} is odd), so isolated sensor spikes at either end never reach the mean.
 * Only values matter, so the result is independent of input order.
 *
 * <p>Stateless, pure and thread-safe.
 */
public final class TrimmedMeanAggregator {

    private TrimmedMeanAggregator() {}

    /**
     * @param series samples in any order; null and non-finite entries are ignored
     * @param n      target window size, must be positive
     * @return the trimmed mean, or {@link OptionalDouble#empty()} when no usable sample exists
     */
    public static OptionalDouble trimmedMean(List<Double> series, int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("trimmed window size must be > 0, got " + n);
        }
        if (series == null || series.isEmpty()) {
            return OptionalDouble.empty();
        }

        double[] sorted = series.stream()
            .filter(v -> v != null && Double.isFinite(v))
            .mapToDouble(Double::doubleValue)
            .sorted()
            .toArray();

        int length = sorted.length;
        if (length == 0) {
            return OptionalDouble.empty();
        }
        if (length <= n) {
            return OptionalDouble.of(mean(sorted, 0, length));
        }

        int start = (length - n) / 2;
        return OptionalDouble.of(mean(sorted, start, start + n));
    }

    private static double mean(double[] values, int fromInclusive, int toExclusive) {
        double sum = 0.0;
        for (int i = fromInclusive; i < toExclusive; i++) {
            sum += values[i];
        }
        return sum / (toExclusive - fromInclusive);
    }
}
