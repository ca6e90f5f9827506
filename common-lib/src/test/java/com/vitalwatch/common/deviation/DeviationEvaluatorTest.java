package com.vitalwatch.common.deviation;

import com.vitalwatch.common.model.DeviationVerdict;
import com.vitalwatch.common.model.SignalThresholds;
import com.vitalwatch.common.model.VerdictStatus;
import com.vitalwatch.common.model.VitalSignal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class DeviationEvaluatorTest {

    private static final double EPS = 1e-9;
    private static final SignalThresholds HR = SignalThresholds.of(20, 0.30);
    private static final SignalThresholds RR = SignalThresholds.of(5, 0.35);

    private static DeviationVerdict hr(double shortWindow, double longWindow) {
        return DeviationEvaluator.evaluate(VitalSignal.HEART_RATE,
            OptionalDouble.of(shortWindow), Optional.of(longWindow), HR);
    }

    @Nested
    @DisplayName("missing aggregates")
    class Missing {

        @Test
        @DisplayName("no short-window value → INSUFFICIENT_DATA, long value kept")
        void noShortWindow() {
            DeviationVerdict v = DeviationEvaluator.evaluate(VitalSignal.HEART_RATE,
                OptionalDouble.empty(), Optional.of(70.0), HR);
            assertEquals(VerdictStatus.INSUFFICIENT_DATA, v.status());
            assertNull(v.shortWindow());
            assertEquals(70.0, v.longWindow());
            assertNull(v.absDiff());
            assertNull(v.relDiff());
        }

        @Test
        @DisplayName("no long-window value → INSUFFICIENT_DATA")
        void noLongWindow() {
            DeviationVerdict v = DeviationEvaluator.evaluate(VitalSignal.RESPIRATION,
                OptionalDouble.of(16.0), Optional.empty(), RR);
            assertEquals(VerdictStatus.INSUFFICIENT_DATA, v.status());
            assertEquals(VitalSignal.RESPIRATION, v.signal());
            assertEquals(16.0, v.shortWindow());
        }
    }

    @Nested
    @DisplayName("comparison")
    class Comparison {

        @ParameterizedTest(name = "x={0}")
        @ValueSource(doubles = {0.5, 14.0, 72.0, 180.0})
        @DisplayName("zero deviation is never anomalous")
        void identicalWindows_normal(double x) {
            DeviationVerdict v = hr(x, x);
            assertEquals(VerdictStatus.NORMAL, v.status());
            assertEquals(0.0, v.absDiff(), EPS);
            assertEquals(0.0, v.relDiff(), EPS);
        }

        @Test
        @DisplayName("abs=20 rel=0.30, short=100 long=70 → ANOMALOUS on absolute swing")
        void absoluteSwing_anomalous() {
            DeviationVerdict v = hr(100, 70);
            assertEquals(VerdictStatus.ANOMALOUS, v.status());
            assertEquals(30.0, v.absDiff(), EPS);
            assertEquals(30.0 / 70.0, v.relDiff(), EPS);
            assertTrue(v.isAnomalous());
        }

        @Test
        @DisplayName("relative swing alone is enough on a low baseline")
        void relativeSwing_anomalous() {
            DeviationVerdict v = DeviationEvaluator.evaluate(VitalSignal.RESPIRATION,
                OptionalDouble.of(12.0), Optional.of(8.0), RR);
            // abs = 4 ≤ 5, rel = 0.5 > 0.35
            assertEquals(VerdictStatus.ANOMALOUS, v.status());
            assertEquals(4.0, v.absDiff(), EPS);
            assertEquals(0.5, v.relDiff(), EPS);
        }

        @Test
        @DisplayName("deviation exactly on the absolute threshold is NORMAL")
        void onThreshold_normal() {
            DeviationVerdict v = hr(90, 70);
            // abs = 20 (not > 20), rel ≈ 0.286 (not > 0.30)
            assertEquals(VerdictStatus.NORMAL, v.status());
        }

        @Test
        @DisplayName("downward drift is judged on the absolute difference")
        void downwardDrift() {
            DeviationVerdict v = hr(45, 70);
            assertEquals(VerdictStatus.ANOMALOUS, v.status());
            assertEquals(25.0, v.absDiff(), EPS);
        }
    }

    @Nested
    @DisplayName("zero long-window baseline")
    class ZeroBaseline {

        @Test
        @DisplayName("long=0 → relDiff=0, small absolute swing stays NORMAL")
        void zeroBaseline_smallSwing() {
            DeviationVerdict v = hr(10, 0);
            assertEquals(0.0, v.relDiff(), EPS);
            assertEquals(VerdictStatus.NORMAL, v.status());
        }

        @Test
        @DisplayName("long=0 → only the absolute threshold can flag")
        void zeroBaseline_largeSwing() {
            DeviationVerdict v = hr(30, 0);
            assertEquals(0.0, v.relDiff(), EPS);
            assertEquals(VerdictStatus.ANOMALOUS, v.status());
        }
    }
}
