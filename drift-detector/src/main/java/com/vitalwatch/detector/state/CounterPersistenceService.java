package com.vitalwatch.detector.state;

import com.vitalwatch.common.model.DeviceHysteresisState;
import com.vitalwatch.common.model.HysteresisState;
import com.vitalwatch.common.model.VitalSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Optional write-through persistence of hysteresis counters, laid out as
 * {@code {signal -> counter}} keyed by device id.
 *
 * <p>The in-memory {@link HysteresisStateStore} stays the source of truth for every cycle.
 * This service mirrors committed counters to the database and seeds the store once on startup.
 * A database failure is logged and never fails a detection cycle.
 *
 * <p>Writes for one device go through a single queue drained one write at a time, and each
 * write stores the device's counters as they stand when it runs. A slow write can therefore
 * never land after a newer one and leave stale counters behind.
 *
 * <p>Disabled by default ({@code detector.state.persistence.enabled=false}); all methods are
 * then no-ops.
 */
@Service
public class CounterPersistenceService {

    private static final Logger log = LoggerFactory.getLogger(CounterPersistenceService.class);

    private final SignalCounterRepository repository;
    private final HysteresisStateStore stateStore;
    private final Map<String, Sinks.Many<String>> writers = new ConcurrentHashMap<>();

    @Value("${detector.state.persistence.enabled:false}")
    private boolean enabled;

    public CounterPersistenceService(SignalCounterRepository repository, HysteresisStateStore stateStore) {
        this.repository = repository;
        this.stateStore = stateStore;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void hydrate() {
        if (!enabled) {
            log.info("Counter persistence disabled. Hysteresis state starts at zero for every device.");
            return;
        }
        repository.findAll()
            .collectMultimap(SignalCounter::getDeviceId)
            .subscribe(
                byDevice -> {
                    byDevice.forEach(this::restoreDevice);
                    log.info("Counter hydration complete. devices={}", byDevice.size());
                },
                err -> log.error("Counter hydration failed. Continuing with zeroed state.", err)
            );
    }

    /** Queues a write of the device's current counters. Returns immediately. */
    public void save(String deviceId) {
        if (!enabled) {
            return;
        }
        Sinks.Many<String> writer = writers.computeIfAbsent(deviceId, this::openWriter);
        Sinks.EmitResult result;
        synchronized (writer) {
            result = writer.tryEmitNext(deviceId);
        }
        if (result.isFailure()) {
            log.warn("Counter persist not queued (non-critical). deviceId={} result={}", deviceId, result);
        }
    }

    private Sinks.Many<String> openWriter(String deviceId) {
        Sinks.Many<String> writer = Sinks.many().unicast().onBackpressureBuffer();
        writer.asFlux()
            .concatMap(this::write)
            .subscribe();
        return writer;
    }

    private Mono<Void> write(String deviceId) {
        return Mono.defer(() -> {
            DeviceHysteresisState state = stateStore.current(deviceId);
            return Flux.just(VitalSignal.values())
                .concatMap(signal -> repository.upsertCounter(deviceId, signal.name(), state.of(signal).counter()))
                .then();
        })
            .onErrorResume(e -> {
                log.warn("Counter persist failed (non-critical). deviceId={} reason={}", deviceId, e.getMessage());
                return Mono.empty();
            });
    }

    private void restoreDevice(String deviceId, Collection<SignalCounter> rows) {
        DeviceHysteresisState state = stateStore.current(deviceId);
        for (SignalCounter row : rows) {
            VitalSignal signal;
            try {
                signal = VitalSignal.valueOf(row.getSignal());
            } catch (IllegalArgumentException e) {
                log.warn("Skipping persisted counter with unknown signal '{}' for deviceId={}",
                         row.getSignal(), deviceId);
                continue;
            }
            HysteresisState base = state.of(signal);
            state = state.with(signal, new HysteresisState(Math.max(0, row.getCounter()), base.triggerThreshold()));
        }
        stateStore.restore(deviceId, state);
    }
}
