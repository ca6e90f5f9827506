package com.vitalwatch.common.hysteresis;

import com.vitalwatch.common.model.DeviceHysteresisState;
import com.vitalwatch.common.model.HysteresisState;
import com.vitalwatch.common.model.VerdictStatus;
import com.vitalwatch.common.model.VitalSignal;

/**
 * Consecutive-anomaly state machine for one device.
 *
 * <h3>Per-signal transition</h3>
 * <ul>
 *   <li>{@code ANOMALOUS} → {@code counter + 1}</li>
 *   <li>{@code NORMAL}, {@code INSUFFICIENT_DATA}, {@code NO_RECENT_DATA} → {@code 0}</li>
 * </ul>
 *
 * <h3>Composite alert</h3>
 * <p>Fires when either signal's counter reaches the trigger threshold. On firing both counters
 * are reset to {@code 0} within the same transition, so a persisting condition has to build a
 * fresh run of {@code triggerThreshold} anomalous cycles before it alerts again.
 *
 * <p>State is passed in and returned; the engine itself holds none and is thread-safe.
 */
public final class AlertHysteresisEngine {

    private AlertHysteresisEngine() {}

    public static HysteresisState advance(VerdictStatus verdict, HysteresisState state) {
        return verdict == VerdictStatus.ANOMALOUS ? state.increment() : state.reset();
    }

    public static boolean compositeAlert(HysteresisState heartRate, HysteresisState respiration) {
        return heartRate.isTriggered() || respiration.isTriggered();
    }

    /**
     * Applies one cycle's verdicts to the device's counter pair.
     *
     * @param prior            counters before this cycle
     * @param heartRateVerdict this cycle's heart-rate verdict
     * @param respirationVerdict this cycle's respiration verdict
     * @return the counters after this cycle and whether the composite alert fired
     */
    public static HysteresisTransition commit(DeviceHysteresisState prior,
                                              VerdictStatus heartRateVerdict,
                                              VerdictStatus respirationVerdict) {
        HysteresisState hr = advance(heartRateVerdict, prior.of(VitalSignal.HEART_RATE));
        HysteresisState rr = advance(respirationVerdict, prior.of(VitalSignal.RESPIRATION));

        if (compositeAlert(hr, rr)) {
            return new HysteresisTransition(
                new DeviceHysteresisState(hr.reset(), rr.reset()), true);
        }
        return new HysteresisTransition(new DeviceHysteresisState(hr, rr), false);
    }

    /**
     * @param next       counters to store
     * @param alertFired true when either counter reached the trigger this cycle
     */
    public record HysteresisTransition(DeviceHysteresisState next, boolean alertFired) {}
}
