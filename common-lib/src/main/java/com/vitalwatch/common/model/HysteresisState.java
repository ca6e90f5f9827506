package com.vitalwatch.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Consecutive-anomaly counter for one signal of one device.
 *
 * <p>Immutable: every transition returns a new instance. The counter only ever moves to
 * {@code counter + 1} or back to {@code 0}.
 */
public record HysteresisState(
    @JsonProperty("counter")          int counter,
    @JsonProperty("triggerThreshold") int triggerThreshold
) {
    public HysteresisState {
        if (counter < 0) {
            throw new IllegalArgumentException("counter must be >= 0, got " + counter);
        }
        if (triggerThreshold < 1) {
            throw new IllegalArgumentException("triggerThreshold must be >= 1, got " + triggerThreshold);
        }
    }

    public static HysteresisState initial(int triggerThreshold) {
        return new HysteresisState(0, triggerThreshold);
    }

    public HysteresisState increment() {
        return new HysteresisState(counter + 1, triggerThreshold);
    }

    public HysteresisState reset() {
        return counter == 0 ? this : new HysteresisState(0, triggerThreshold);
    }

    @JsonIgnore
    public boolean isTriggered() {
        return counter >= triggerThreshold;
    }
}
