package com.vitalwatch.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The counter pair owned by a single device. Devices never share an instance.
 */
public record DeviceHysteresisState(
    @JsonProperty("heartRate")   HysteresisState heartRate,
    @JsonProperty("respiration") HysteresisState respiration
) {
    public static DeviceHysteresisState initial(int triggerThreshold) {
        HysteresisState zero = HysteresisState.initial(triggerThreshold);
        return new DeviceHysteresisState(zero, zero);
    }

    public HysteresisState of(VitalSignal signal) {
        return switch (signal) {
            case HEART_RATE  -> heartRate;
            case RESPIRATION -> respiration;
        };
    }

    public DeviceHysteresisState with(VitalSignal signal, HysteresisState state) {
        return switch (signal) {
            case HEART_RATE  -> new DeviceHysteresisState(state, respiration);
            case RESPIRATION -> new DeviceHysteresisState(heartRate, state);
        };
    }
}
