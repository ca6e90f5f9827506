package com.vitalwatch.detector.logger;

import com.vitalwatch.common.model.CycleResult;
import com.vitalwatch.common.model.DeviationVerdict;
import com.vitalwatch.common.model.VitalSignal;
import com.vitalwatch.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.Locale;
import java.util.function.Consumer;

/**
 * Observability for the detection cycle. Logs each stage and the per-signal comparisons
 * without influencing the cycle.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #TRIGGER_RECEIVED}   — cycle requested by the scheduler or the API</li>
 *   <li>{@link #READINGS_FETCHED}   — all four store queries answered</li>
 *   <li>{@link #VERDICTS_COMMITTED} — verdicts applied to the device's counters</li>
 *   <li>{@link #RESULT_PUBLISHED}   — result handed to the alert publisher</li>
 * </ol>
 */
@Component
public class CycleFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(CycleFlowLogger.class);

    public static final String TRIGGER_RECEIVED   = "TRIGGER_RECEIVED";
    public static final String READINGS_FETCHED   = "READINGS_FETCHED";
    public static final String VERDICTS_COMMITTED = "VERDICTS_COMMITTED";
    public static final String RESULT_PUBLISHED   = "RESULT_PUBLISHED";

    /**
     * Returns a {@code doOnEach} consumer logging {@code stageName} on every {@code onNext},
     * with the traceId read from the Reactor Context.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[CycleFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    /**
     * Logs the outcome of a finished cycle: one line per signal verdict, then the composite
     * alert (WARN) or the offline / store-failure notice.
     */
    public void logResult(CycleResult result) {
        TraceContextUtil.withMdc(result.traceId(), () -> {
            switch (result.outcome()) {
                case DEVICE_OFFLINE -> log.warn(
                    "Device offline: no heart-rate or respiration data in either window, judgment skipped. "
                    + "deviceId={} hrCounter={} rrCounter={}",
                    result.deviceId(), result.heartRateCounter(), result.respirationCounter());
                case STORE_UNAVAILABLE -> log.error(
                    "Cycle aborted, sample store unavailable. deviceId={} reason={}",
                    result.deviceId(), result.failureReason());
                case EVALUATED -> {
                    logVerdict(result.deviceId(), result.verdict(VitalSignal.HEART_RATE));
                    logVerdict(result.deviceId(), result.verdict(VitalSignal.RESPIRATION));
                    if (result.alertFired()) {
                        log.warn("ALERT: sustained vital-sign drift. deviceId={} trigger={} consecutive cycles",
                                 result.deviceId(), result.triggerThreshold());
                    }
                    log.info("Counters committed. deviceId={} hrCounter={} rrCounter={} alertFired={}",
                             result.deviceId(), result.heartRateCounter(),
                             result.respirationCounter(), result.alertFired());
                }
            }
        });
    }

    private void logVerdict(String deviceId, DeviationVerdict v) {
        String label = v.signal().label();
        switch (v.status()) {
            case NO_RECENT_DATA -> log.info("{} no recent data, skipped. deviceId={}", label, deviceId);
            case INSUFFICIENT_DATA -> log.info("{} insufficient data. deviceId={} short={} long={}",
                                               label, deviceId, v.shortWindow(), v.longWindow());
            case NORMAL, ANOMALOUS -> log.info("{} {} deviceId={} short={} long={} abs={} rel={}",
                label, v.status(), deviceId,
                fixed(v.shortWindow(), 2), fixed(v.longWindow(), 2),
                fixed(v.absDiff(), 2), fixed(v.relDiff(), 3));
        }
    }

    /** Fixed-point rendering independent of the JVM default locale. */
    static String fixed(double value, int digits) {
        return String.format(Locale.ROOT, "%." + digits + "f", value);
    }
}
