package com.vitalwatch.detector.store;

import com.vitalwatch.common.model.VitalSignal;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * The two windowed reads a detection cycle needs from the time-series store.
 *
 * <p>"No data" is a successful answer: an empty list or {@link Optional#empty()}.
 * Any failure to answer (transport, status, payload) MUST surface as a
 * {@link com.vitalwatch.common.exception.StoreUnavailableException} error signal.
 * Implementations must never complete empty.
 */
public interface SampleStoreClient {

    Mono<List<Double>> querySeries(VitalSignal signal, String deviceId, SeriesWindow window);

    Mono<Optional<Double>> queryScalar(VitalSignal signal, String deviceId, PointWindow window);
}
