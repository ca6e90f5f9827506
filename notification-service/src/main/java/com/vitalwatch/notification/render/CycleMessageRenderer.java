package com.vitalwatch.notification.render;

import com.vitalwatch.common.model.CycleOutcome;
import com.vitalwatch.common.model.CycleResult;
import com.vitalwatch.common.model.DeviationVerdict;
import com.vitalwatch.common.model.VitalSignal;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a {@link CycleResult} into human-readable alert text.
 */
public final class CycleMessageRenderer {

    private CycleMessageRenderer() {}

    /**
     * One line per anomalous signal, e.g.
     * {@code HR anomaly: short=98.0 long=70.0 abs=28.0 rel=0.40}. Empty unless the cycle was
     * evaluated and at least one signal drifted.
     */
    public static List<String> anomalyLines(CycleResult result) {
        List<String> lines = new ArrayList<>(2);
        if (result.outcome() != CycleOutcome.EVALUATED) {
            return lines;
        }
        for (VitalSignal signal : VitalSignal.values()) {
            DeviationVerdict v = result.verdict(signal);
            if (v != null && v.isAnomalous()) {
                lines.add(String.format(Locale.ROOT, "%s anomaly: short=%.1f long=%.1f abs=%.1f rel=%.2f",
                    signal.label(), v.shortWindow(), v.longWindow(), v.absDiff(), v.relDiff()));
            }
        }
        return lines;
    }

    /** Header line of a fired composite alert. */
    public static String alertHeadline(CycleResult result) {
        return String.format("Sustained vital-sign drift on device %s: %d consecutive anomalous cycles",
            result.deviceId(), result.triggerThreshold());
    }

    /** Full Slack message body. */
    public static String render(CycleResult result) {
        StringBuilder sb = new StringBuilder();
        switch (result.outcome()) {
            case DEVICE_OFFLINE -> sb.append(String.format(
                "*Device %s offline* | `traceId: %s`%nNo heart-rate or respiration data in the recent window.",
                result.deviceId(), result.traceId()));
            case STORE_UNAVAILABLE -> sb.append(String.format(
                "*Detection skipped for %s* | `traceId: %s`%nSample store unavailable: %s",
                result.deviceId(), result.traceId(), result.failureReason()));
            case EVALUATED -> {
                if (result.alertFired()) {
                    sb.append(String.format("*ALERT: %s* | `traceId: %s`%n", alertHeadline(result), result.traceId()));
                } else {
                    sb.append(String.format("*Vital signs: %s* | `traceId: %s`%n", result.deviceId(), result.traceId()));
                }
                sb.append("---\n");
                List<String> anomalies = anomalyLines(result);
                if (anomalies.isEmpty()) {
                    sb.append("No anomalies\n");
                } else {
                    anomalies.forEach(line -> sb.append(line).append('\n'));
                }
                sb.append(String.format("Counters: HR=%d RR=%d (trigger %d)",
                    result.heartRateCounter(), result.respirationCounter(), result.triggerThreshold()));
            }
        }
        return sb.toString();
    }
}
