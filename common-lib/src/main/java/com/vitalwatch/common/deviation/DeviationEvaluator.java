package com.vitalwatch.common.deviation;

import com.vitalwatch.common.model.DeviationVerdict;
import com.vitalwatch.common.model.SignalThresholds;
import com.vitalwatch.common.model.VitalSignal;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Compares the trimmed short-window value of a signal against its long-window mean.
 *
 * <h3>Rules</h3>
 * <ul>
 *   <li>either aggregate missing → {@code INSUFFICIENT_DATA}</li>
 *   <li>{@code absDiff = |short − long|}</li>
 *   <li>{@code relDiff = absDiff / long}, or {@code 0} when {@code long == 0}</li>
 *   <li>{@code absDiff > absThreshold} OR {@code relDiff > relThreshold} → {@code ANOMALOUS},
 *       otherwise {@code NORMAL}</li>
 * </ul>
 *
 * <p>The OR lets a proportional swing flag low baselines and a fixed swing flag high ones.
 * Both comparisons are strict: a deviation sitting exactly on a threshold is normal.
 *
 * <p>This class is stateless, pure, and thread-safe.
 */
public final class DeviationEvaluator {

    private DeviationEvaluator() {}

    /**
     * @param signal      the signal being judged (carried into the verdict)
     * @param shortWindow trimmed short-window value
     * @param longWindow  long-window point mean
     * @param thresholds  the signal's absolute/relative limits
     * @return the verdict with both diffs attached; never null
     */
    public static DeviationVerdict evaluate(VitalSignal signal,
                                            OptionalDouble shortWindow,
                                            Optional<Double> longWindow,
                                            SignalThresholds thresholds) {
        if (shortWindow.isEmpty() || longWindow.isEmpty()) {
            return DeviationVerdict.insufficientData(signal,
                shortWindow.isPresent() ? shortWindow.getAsDouble() : null,
                longWindow.orElse(null));
        }

        double shortValue = shortWindow.getAsDouble();
        double longValue  = longWindow.get();

        double absDiff = Math.abs(shortValue - longValue);
        double relDiff = longValue != 0 ? absDiff / longValue : 0.0;

        boolean anomalous = absDiff > thresholds.absThreshold()
                         || relDiff > thresholds.relThreshold();

        return DeviationVerdict.compared(signal, anomalous, shortValue, longValue, absDiff, relDiff);
    }
}
