package com.vitalwatch.detector.service;

import com.vitalwatch.common.alert.AlertPublisher;
import com.vitalwatch.common.event.DetectionEvent;
import com.vitalwatch.common.exception.StoreUnavailableException;
import com.vitalwatch.common.model.CycleResult;
import com.vitalwatch.common.model.DetectionConfig;
import com.vitalwatch.common.model.SignalReadings;
import com.vitalwatch.common.model.VitalSignal;
import com.vitalwatch.common.policy.DetectionCyclePolicy;
import com.vitalwatch.common.policy.DetectionCyclePolicy.CycleStep;
import com.vitalwatch.common.trace.TraceContextUtil;
import com.vitalwatch.detector.logger.CycleFlowLogger;
import com.vitalwatch.detector.state.CounterPersistenceService;
import com.vitalwatch.detector.state.HysteresisStateStore;
import com.vitalwatch.detector.store.PointWindow;
import com.vitalwatch.detector.store.SampleStoreClient;
import com.vitalwatch.detector.store.SeriesWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Runs one detection cycle for one device.
 *
 * <pre>
 *   4 store queries (concurrent, each with a timeout)
 *     → both signals silent?  → DEVICE_OFFLINE, counters untouched
 *     → judge + commit counters atomically → EVALUATED
 *   any query failure       → STORE_UNAVAILABLE, counters untouched
 *   every result            → logged and published
 * </pre>
 *
 * <p>A store failure is never read as "no data".
 */
@Service
public class DetectionCycleService {

    private static final Logger log = LoggerFactory.getLogger(DetectionCycleService.class);

    private final SampleStoreClient storeClient;
    private final HysteresisStateStore stateStore;
    private final CounterPersistenceService counterPersistence;
    private final AlertPublisher alertPublisher;
    private final CycleFlowLogger flowLogger;
    private final DetectionConfig detectionConfig;
    private final SeriesWindow seriesWindow;
    private final PointWindow pointWindow;
    private final Duration queryTimeout;

    public DetectionCycleService(
            SampleStoreClient storeClient,
            HysteresisStateStore stateStore,
            CounterPersistenceService counterPersistence,
            AlertPublisher alertPublisher,
            CycleFlowLogger flowLogger,
            DetectionConfig detectionConfig,
            SeriesWindow seriesWindow,
            PointWindow pointWindow,
            @Value("${detector.store.query-timeout:10s}") Duration queryTimeout) {
        this.storeClient        = storeClient;
        this.stateStore         = stateStore;
        this.counterPersistence = counterPersistence;
        this.alertPublisher     = alertPublisher;
        this.flowLogger         = flowLogger;
        this.detectionConfig    = detectionConfig;
        this.seriesWindow       = seriesWindow;
        this.pointWindow        = pointWindow;
        this.queryTimeout       = queryTimeout;
    }

    /**
     * @param event device to evaluate and the trace id of this run
     * @return the cycle result; store failures arrive as a {@code STORE_UNAVAILABLE} result,
     *         not as an error signal
     */
    public Mono<CycleResult> runCycle(DetectionEvent event) {
        String deviceId = event.deviceId();
        String traceId  = event.traceId();

        Mono<CycleResult> cycle = Mono.just(event)
            .doOnEach(flowLogger.stage(CycleFlowLogger.TRIGGER_RECEIVED))
            .flatMap(e -> Mono.zip(
                fetch(VitalSignal.HEART_RATE, deviceId),
                fetch(VitalSignal.RESPIRATION, deviceId)))
            .doOnEach(flowLogger.stage(CycleFlowLogger.READINGS_FETCHED))
            .map(readings -> judgeAndCommit(deviceId, traceId, readings.getT1(), readings.getT2()))
            .doOnEach(flowLogger.stage(CycleFlowLogger.VERDICTS_COMMITTED))
            .onErrorResume(StoreUnavailableException.class, e -> Mono.just(
                CycleResult.storeUnavailable(deviceId, traceId, Instant.now(),
                                             stateStore.current(deviceId), e.getMessage())))
            .doOnNext(result -> {
                flowLogger.logResult(result);
                alertPublisher.publish(result);
            })
            .doOnEach(flowLogger.stage(CycleFlowLogger.RESULT_PUBLISHED));

        return TraceContextUtil.withTraceId(cycle, traceId);
    }

    private CycleResult judgeAndCommit(String deviceId, String traceId,
                                       SignalReadings heartRate, SignalReadings respiration) {
        log.info("Readings fetched. deviceId={} hrSeries={} hrPoint={} rrSeries={} rrPoint={}",
                 deviceId, heartRate.series().size(), heartRate.point().orElse(null),
                 respiration.series().size(), respiration.point().orElse(null));

        Instant now = Instant.now();
        if (DetectionCyclePolicy.isOffline(heartRate, respiration)) {
            return CycleResult.offline(deviceId, traceId, now, stateStore.current(deviceId));
        }

        CycleStep step = stateStore.commit(deviceId, prior ->
            DetectionCyclePolicy.apply(deviceId, traceId, now, heartRate, respiration, detectionConfig, prior));

        counterPersistence.save(deviceId);
        return step.result();
    }

    private Mono<SignalReadings> fetch(VitalSignal signal, String deviceId) {
        return Mono.defer(() -> {
            Mono<List<Double>> series = storeClient.querySeries(signal, deviceId, seriesWindow)
                .defaultIfEmpty(List.of())
                .timeout(queryTimeout);
            Mono<Optional<Double>> point = storeClient.queryScalar(signal, deviceId, pointWindow)
                .defaultIfEmpty(Optional.empty())
                .timeout(queryTimeout);
            return Mono.zip(series, point);
        })
            .map(t -> SignalReadings.of(signal, t.getT1(), t.getT2()))
            .onErrorMap(e -> !(e instanceof StoreUnavailableException),
                        e -> new StoreUnavailableException(deviceId,
                            signal.label() + " query failed: " + describe(e), e));
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
