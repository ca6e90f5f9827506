package com.vitalwatch.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Structurally complete record of one detection cycle for one device. This is the only thing the
 * alert sink ever receives.
 *
 * <p>{@code heartRate} / {@code respiration} verdicts are null unless {@code outcome} is
 * {@link CycleOutcome#EVALUATED}. Counters always reflect the device state after the cycle
 * (unchanged for offline and store-failure cycles). {@code failureReason} is set only for
 * {@link CycleOutcome#STORE_UNAVAILABLE}.
 */
public record CycleResult(
    @JsonProperty("deviceId")           String           deviceId,
    @JsonProperty("traceId")            String           traceId,
    @JsonProperty("evaluatedAt")        Instant          evaluatedAt,
    @JsonProperty("outcome")            CycleOutcome     outcome,
    @JsonProperty("heartRate")          DeviationVerdict heartRate,
    @JsonProperty("respiration")        DeviationVerdict respiration,
    @JsonProperty("heartRateCounter")   int              heartRateCounter,
    @JsonProperty("respirationCounter") int              respirationCounter,
    @JsonProperty("triggerThreshold")   int              triggerThreshold,
    @JsonProperty("alertFired")         boolean          alertFired,
    @JsonProperty("failureReason")      String           failureReason
) {
    public static CycleResult evaluated(String deviceId, String traceId, Instant at,
                                        DeviationVerdict heartRate, DeviationVerdict respiration,
                                        DeviceHysteresisState state, boolean alertFired) {
        return new CycleResult(deviceId, traceId, at, CycleOutcome.EVALUATED,
            heartRate, respiration,
            state.heartRate().counter(), state.respiration().counter(),
            state.heartRate().triggerThreshold(), alertFired, null);
    }

    public static CycleResult offline(String deviceId, String traceId, Instant at,
                                      DeviceHysteresisState state) {
        return new CycleResult(deviceId, traceId, at, CycleOutcome.DEVICE_OFFLINE,
            null, null,
            state.heartRate().counter(), state.respiration().counter(),
            state.heartRate().triggerThreshold(), false, null);
    }

    public static CycleResult storeUnavailable(String deviceId, String traceId, Instant at,
                                               DeviceHysteresisState state, String reason) {
        return new CycleResult(deviceId, traceId, at, CycleOutcome.STORE_UNAVAILABLE,
            null, null,
            state.heartRate().counter(), state.respiration().counter(),
            state.heartRate().triggerThreshold(), false, reason);
    }

    public DeviationVerdict verdict(VitalSignal signal) {
        return switch (signal) {
            case HEART_RATE  -> heartRate;
            case RESPIRATION -> respiration;
        };
    }
}
