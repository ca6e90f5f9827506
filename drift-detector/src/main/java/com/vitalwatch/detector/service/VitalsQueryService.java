package com.vitalwatch.detector.service;

import com.vitalwatch.detector.dto.VitalsQueryRequest;
import com.vitalwatch.detector.store.FluxQueryBuilder;
import com.vitalwatch.detector.store.InfluxSampleStoreClient;
import com.vitalwatch.detector.store.PointWindow;
import com.vitalwatch.detector.store.SeriesWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Read-only pass-through to the sample store for dashboards: runs either a caller-supplied Flux
 * script or one of the two canned detector queries, and returns the parsed rows.
 */
@Service
public class VitalsQueryService {

    private static final Logger log = LoggerFactory.getLogger(VitalsQueryService.class);

    public static final String MODE_SERIES = "tma2m";
    public static final String MODE_MEAN   = "mean5m";

    private final InfluxSampleStoreClient storeClient;
    private final SeriesWindow seriesWindow;
    private final PointWindow pointWindow;

    @Value("${detector.device-id:84F7035346E0}")
    private String defaultDeviceId;

    public VitalsQueryService(InfluxSampleStoreClient storeClient,
                              SeriesWindow seriesWindow,
                              PointWindow pointWindow) {
        this.storeClient  = storeClient;
        this.seriesWindow = seriesWindow;
        this.pointWindow  = pointWindow;
    }

    /**
     * @throws IllegalArgumentException (as an error signal) when neither a query nor a valid
     *         field/mode pair is supplied
     */
    public Mono<List<Map<String, String>>> query(VitalsQueryRequest request) {
        return Mono.fromCallable(() -> resolveFlux(request))
            .doOnNext(flux -> log.info("Vitals query received. query={}", flux))
            .flatMap(flux -> storeClient.queryRows(deviceIdOf(request), flux))
            .doOnNext(rows -> log.info("Vitals query succeeded. recordCount={}", rows.size()));
    }

    String resolveFlux(VitalsQueryRequest request) {
        if (!isBlank(request.query())) {
            return request.query();
        }
        if (isBlank(request.field())) {
            throw new IllegalArgumentException("field is required when query is empty");
        }

        String bucket   = firstNonBlank(request.bucket(), storeClient.bucket());
        String deviceId = deviceIdOf(request);

        if (MODE_SERIES.equals(request.mode())) {
            return FluxQueryBuilder.series(bucket, deviceId, request.field(), seriesWindow);
        }
        if (MODE_MEAN.equals(request.mode())) {
            return FluxQueryBuilder.mean(bucket, deviceId, request.field(), pointWindow);
        }
        throw new IllegalArgumentException(
            "unsupported mode '" + request.mode() + "', use " + MODE_SERIES + " or " + MODE_MEAN);
    }

    private String deviceIdOf(VitalsQueryRequest request) {
        return firstNonBlank(request.deviceId(), defaultDeviceId);
    }

    private static String firstNonBlank(String value, String fallback) {
        return isBlank(value) ? fallback : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
