package com.vitalwatch.common.hysteresis;

import com.vitalwatch.common.hysteresis.AlertHysteresisEngine.HysteresisTransition;
import com.vitalwatch.common.model.DeviceHysteresisState;
import com.vitalwatch.common.model.HysteresisState;
import com.vitalwatch.common.model.VerdictStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.vitalwatch.common.model.VerdictStatus.ANOMALOUS;
import static com.vitalwatch.common.model.VerdictStatus.NORMAL;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Counter transitions and composite-alert debounce of {@link AlertHysteresisEngine}.
 */
class AlertHysteresisEngineTest {

    private static final int TRIGGER = 3;

    // ── advance() ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("advance() — single signal")
    class Advance {

        @Test
        @DisplayName("ANOMALOUS increments by exactly one")
        void anomalous_increments() {
            HysteresisState s = HysteresisState.initial(TRIGGER);
            s = AlertHysteresisEngine.advance(ANOMALOUS, s);
            assertEquals(1, s.counter());
            s = AlertHysteresisEngine.advance(ANOMALOUS, s);
            assertEquals(2, s.counter());
        }

        @ParameterizedTest(name = "{0} resets")
        @EnumSource(value = VerdictStatus.class, names = {"NORMAL", "INSUFFICIENT_DATA", "NO_RECENT_DATA"})
        @DisplayName("every non-anomalous verdict resets to zero")
        void nonAnomalous_resets(VerdictStatus verdict) {
            HysteresisState s = new HysteresisState(2, TRIGGER);
            assertEquals(0, AlertHysteresisEngine.advance(verdict, s).counter());
        }

        @Test
        @DisplayName("trigger threshold is carried through transitions")
        void thresholdPreserved() {
            HysteresisState s = AlertHysteresisEngine.advance(ANOMALOUS, HysteresisState.initial(5));
            assertEquals(5, s.triggerThreshold());
        }
    }

    // ── compositeAlert() ──────────────────────────────────────────────────

    @Nested
    @DisplayName("compositeAlert()")
    class Composite {

        @Test
        @DisplayName("either signal at the trigger fires")
        void eitherSignalFires() {
            assertTrue(AlertHysteresisEngine.compositeAlert(
                new HysteresisState(3, TRIGGER), new HysteresisState(0, TRIGGER)));
            assertTrue(AlertHysteresisEngine.compositeAlert(
                new HysteresisState(0, TRIGGER), new HysteresisState(3, TRIGGER)));
        }

        @Test
        @DisplayName("two signals below the trigger do not add up")
        void belowTrigger_noAlert() {
            assertFalse(AlertHysteresisEngine.compositeAlert(
                new HysteresisState(2, TRIGGER), new HysteresisState(2, TRIGGER)));
        }
    }

    // ── commit() — full pair transition ───────────────────────────────────

    @Nested
    @DisplayName("commit() — device counter pair")
    class Commit {

        @Test
        @DisplayName("[ANOMALOUS × 3] fires exactly on the third step and resets both counters")
        void threeAnomalous_firesOnThird() {
            DeviceHysteresisState state = DeviceHysteresisState.initial(TRIGGER);

            HysteresisTransition first = AlertHysteresisEngine.commit(state, ANOMALOUS, ANOMALOUS);
            assertFalse(first.alertFired());
            assertEquals(1, first.next().heartRate().counter());

            HysteresisTransition second = AlertHysteresisEngine.commit(first.next(), ANOMALOUS, ANOMALOUS);
            assertFalse(second.alertFired());
            assertEquals(2, second.next().respiration().counter());

            HysteresisTransition third = AlertHysteresisEngine.commit(second.next(), ANOMALOUS, ANOMALOUS);
            assertTrue(third.alertFired());
            assertEquals(0, third.next().heartRate().counter());
            assertEquals(0, third.next().respiration().counter());
        }

        @Test
        @DisplayName("a single NORMAL inside a streak gives no partial credit")
        void normalBreaksStreak() {
            DeviceHysteresisState state = DeviceHysteresisState.initial(TRIGGER);
            state = AlertHysteresisEngine.commit(state, ANOMALOUS, NORMAL).next();
            state = AlertHysteresisEngine.commit(state, ANOMALOUS, NORMAL).next();
            state = AlertHysteresisEngine.commit(state, NORMAL, NORMAL).next();
            assertEquals(0, state.heartRate().counter());

            HysteresisTransition t = AlertHysteresisEngine.commit(state, ANOMALOUS, NORMAL);
            assertFalse(t.alertFired());
            assertEquals(1, t.next().heartRate().counter());
        }

        @Test
        @DisplayName("heart rate alone fires the composite alert; respiration stays at zero")
        void heartRateAlone() {
            DeviceHysteresisState state = DeviceHysteresisState.initial(TRIGGER);
            boolean fired = false;
            for (int cycle = 1; cycle <= 3; cycle++) {
                HysteresisTransition t = AlertHysteresisEngine.commit(state, ANOMALOUS, NORMAL);
                assertEquals(0, t.next().respiration().counter());
                fired = t.alertFired();
                assertEquals(cycle == 3, fired, "cycle " + cycle);
                state = t.next();
            }
            assertTrue(fired);
        }

        @Test
        @DisplayName("after firing, a persisting condition needs a fresh full run to re-alert")
        void debounceAfterFire() {
            DeviceHysteresisState state = DeviceHysteresisState.initial(TRIGGER);
            for (int i = 0; i < 3; i++) {
                state = AlertHysteresisEngine.commit(state, ANOMALOUS, NORMAL).next();
            }
            assertEquals(0, state.heartRate().counter());

            assertFalse(AlertHysteresisEngine.commit(state, ANOMALOUS, NORMAL).alertFired());
            state = AlertHysteresisEngine.commit(state, ANOMALOUS, NORMAL).next();
            state = AlertHysteresisEngine.commit(state, ANOMALOUS, NORMAL).next();
            assertTrue(AlertHysteresisEngine.commit(state, ANOMALOUS, NORMAL).alertFired());
        }

        @Test
        @DisplayName("a firing signal also clears the other signal's partial streak")
        void firingClearsPartnerStreak() {
            DeviceHysteresisState state = new DeviceHysteresisState(
                new HysteresisState(2, TRIGGER), new HysteresisState(1, TRIGGER));
            HysteresisTransition t = AlertHysteresisEngine.commit(state, ANOMALOUS, ANOMALOUS);
            assertTrue(t.alertFired());
            assertEquals(0, t.next().respiration().counter());
        }
    }

    @Test
    @DisplayName("negative counters are unrepresentable")
    void negativeCounter_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new HysteresisState(-1, TRIGGER));
    }
}
