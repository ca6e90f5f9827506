package com.vitalwatch.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-signal outcome of the deviation comparison.
 *
 * <p>{@code shortWindow} / {@code longWindow} hold whichever aggregates were available;
 * {@code absDiff} / {@code relDiff} are populated only for {@link VerdictStatus#NORMAL} and
 * {@link VerdictStatus#ANOMALOUS}, where both aggregates existed.
 */
public record DeviationVerdict(
    @JsonProperty("signal")      VitalSignal   signal,
    @JsonProperty("status")      VerdictStatus status,
    @JsonProperty("shortWindow") Double        shortWindow,
    @JsonProperty("longWindow")  Double        longWindow,
    @JsonProperty("absDiff")     Double        absDiff,
    @JsonProperty("relDiff")     Double        relDiff
) {
    public static DeviationVerdict noRecentData(VitalSignal signal) {
        return new DeviationVerdict(signal, VerdictStatus.NO_RECENT_DATA, null, null, null, null);
    }

    public static DeviationVerdict insufficientData(VitalSignal signal, Double shortWindow, Double longWindow) {
        return new DeviationVerdict(signal, VerdictStatus.INSUFFICIENT_DATA, shortWindow, longWindow, null, null);
    }

    public static DeviationVerdict compared(VitalSignal signal, boolean anomalous,
                                            double shortWindow, double longWindow,
                                            double absDiff, double relDiff) {
        return new DeviationVerdict(signal,
            anomalous ? VerdictStatus.ANOMALOUS : VerdictStatus.NORMAL,
            shortWindow, longWindow, absDiff, relDiff);
    }

    @JsonIgnore
    public boolean isAnomalous() {
        return status == VerdictStatus.ANOMALOUS;
    }
}
