package com.vitalwatch.detector.state;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface SignalCounterRepository extends ReactiveCrudRepository<SignalCounter, Long> {

    /**
     * Atomic UPSERT of one (device, signal) counter.
     *
     * @param deviceId device identifier
     * @param signal   {@code HEART_RATE} or {@code RESPIRATION}
     * @param counter  counter value after the committed cycle
     */
    @Modifying
    @Query("""
        MERGE INTO hysteresis_counters (device_id, signal, counter, updated_at)
        KEY (device_id, signal)
        VALUES (:deviceId, :signal, :counter, CURRENT_TIMESTAMP)
        """)
    Mono<Integer> upsertCounter(String deviceId, String signal, int counter);
}
