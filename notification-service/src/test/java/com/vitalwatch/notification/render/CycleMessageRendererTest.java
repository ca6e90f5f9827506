package com.vitalwatch.notification.render;

import com.vitalwatch.common.model.CycleResult;
import com.vitalwatch.common.model.DeviationVerdict;
import com.vitalwatch.common.model.DeviceHysteresisState;
import com.vitalwatch.common.model.VitalSignal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CycleMessageRendererTest {

    private static final Instant AT = Instant.parse("2024-05-01T00:00:00Z");

    static CycleResult evaluated(boolean hrAnomalous, boolean alertFired) {
        DeviationVerdict hr = DeviationVerdict.compared(VitalSignal.HEART_RATE, hrAnomalous,
            98.0, 70.0, 28.0, 0.4);
        DeviationVerdict rr = DeviationVerdict.compared(VitalSignal.RESPIRATION, false,
            14.0, 14.5, 0.5, 0.034);
        return CycleResult.evaluated("84F7035346E0", "t-1", AT, hr, rr,
            DeviceHysteresisState.initial(3), alertFired);
    }

    @Test
    @DisplayName("anomalous signals get one line each with both aggregates and differences")
    void anomalyLine() {
        assertEquals(List.of("HR anomaly: short=98.0 long=70.0 abs=28.0 rel=0.40"),
                     CycleMessageRenderer.anomalyLines(evaluated(true, false)));
    }

    @Test
    @DisplayName("normal cycles render no anomaly lines")
    void noAnomalies() {
        CycleResult result = evaluated(false, false);

        assertTrue(CycleMessageRenderer.anomalyLines(result).isEmpty());
        assertTrue(CycleMessageRenderer.render(result).contains("No anomalies"));
    }

    @Test
    @DisplayName("a fired alert leads with the composite alert headline")
    void firedAlert() {
        String text = CycleMessageRenderer.render(evaluated(true, true));

        assertTrue(text.startsWith("*ALERT: Sustained vital-sign drift on device 84F7035346E0"));
        assertTrue(text.contains("HR anomaly"));
        assertTrue(text.contains("Counters: HR=0 RR=0 (trigger 3)"));
    }

    @Test
    @DisplayName("offline and store failures render their own notice")
    void nonEvaluated() {
        DeviceHysteresisState state = DeviceHysteresisState.initial(3);

        String offline = CycleMessageRenderer.render(CycleResult.offline("dev", "t", AT, state));
        String store   = CycleMessageRenderer.render(
            CycleResult.storeUnavailable("dev", "t", AT, state, "[dev] HR query failed: timeout"));

        assertTrue(offline.contains("Device dev offline"));
        assertTrue(store.contains("Sample store unavailable: [dev] HR query failed: timeout"));
        assertTrue(CycleMessageRenderer.anomalyLines(CycleResult.offline("dev", "t", AT, state)).isEmpty());
    }
}
