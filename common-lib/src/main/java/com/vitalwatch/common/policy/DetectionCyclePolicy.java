package com.vitalwatch.common.policy;

import com.vitalwatch.common.aggregate.TrimmedMeanAggregator;
import com.vitalwatch.common.deviation.DeviationEvaluator;
import com.vitalwatch.common.hysteresis.AlertHysteresisEngine;
import com.vitalwatch.common.hysteresis.AlertHysteresisEngine.HysteresisTransition;
import com.vitalwatch.common.model.CycleResult;
import com.vitalwatch.common.model.DetectionConfig;
import com.vitalwatch.common.model.DeviationVerdict;
import com.vitalwatch.common.model.DeviceHysteresisState;
import com.vitalwatch.common.model.SignalReadings;

import java.time.Instant;

/**
 * Judgment half of a detection cycle, once the store has answered.
 *
 * <ol>
 *   <li>Both signals silent → device offline: no evaluation, counters returned unchanged.</li>
 *   <li>A silent signal gets {@code NO_RECENT_DATA} without computing its trimmed mean;
 *       the other signal is still judged.</li>
 *   <li>Otherwise {@code evaluate(trimmedMean(series, n), point, thresholds)}.</li>
 *   <li>Both verdicts are committed to the hysteresis pair in a single transition.</li>
 * </ol>
 *
 * <p>No I/O, no logging, no Spring. The reactive cycle service calls {@link #apply} inside the
 * per-device commit so the read-modify-write of the counters is atomic.
 */
public final class DetectionCyclePolicy {

    private DetectionCyclePolicy() {}

    public static boolean isOffline(SignalReadings heartRate, SignalReadings respiration) {
        return heartRate.noRecentData() && respiration.noRecentData();
    }

    public static DeviationVerdict judge(SignalReadings readings, DetectionConfig config) {
        if (readings.noRecentData()) {
            return DeviationVerdict.noRecentData(readings.signal());
        }
        return DeviationEvaluator.evaluate(
            readings.signal(),
            TrimmedMeanAggregator.trimmedMean(readings.series(), config.trimWindow()),
            readings.point(),
            config.thresholds(readings.signal()));
    }

    /**
     * Runs the full judgment for one device.
     *
     * @param prior the device's counters before this cycle
     * @return the cycle result and the counters to store (identical to {@code prior} when offline)
     */
    public static CycleStep apply(String deviceId, String traceId, Instant at,
                                  SignalReadings heartRate, SignalReadings respiration,
                                  DetectionConfig config, DeviceHysteresisState prior) {
        if (isOffline(heartRate, respiration)) {
            return new CycleStep(CycleResult.offline(deviceId, traceId, at, prior), prior);
        }

        DeviationVerdict hrVerdict = judge(heartRate, config);
        DeviationVerdict rrVerdict = judge(respiration, config);

        HysteresisTransition transition =
            AlertHysteresisEngine.commit(prior, hrVerdict.status(), rrVerdict.status());

        CycleResult result = CycleResult.evaluated(deviceId, traceId, at,
            hrVerdict, rrVerdict, transition.next(), transition.alertFired());
        return new CycleStep(result, transition.next());
    }

    public record CycleStep(CycleResult result, DeviceHysteresisState next) {}
}
