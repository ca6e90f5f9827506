package com.vitalwatch.detector.store;

import com.vitalwatch.common.exception.StoreUnavailableException;
import com.vitalwatch.common.model.VitalSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link SampleStoreClient} backed by the InfluxDB v2 HTTP query API.
 *
 * <p>Each read POSTs a Flux script to {@code /api/v2/query?org=...} asking for CSV, then parses
 * the body with {@link FluxCsvParser}. Every failure on the way (no token configured,
 * connection refused, non-2xx status, unreadable CSV) is reported as
 * {@link StoreUnavailableException}; an empty table is a normal "no data" answer.
 */
public class InfluxSampleStoreClient implements SampleStoreClient {

    private static final Logger log = LoggerFactory.getLogger(InfluxSampleStoreClient.class);

    private final WebClient influxClient;
    private final String org;
    private final String token;
    private final String bucket;

    public InfluxSampleStoreClient(WebClient influxClient, String org, String token, String bucket) {
        this.influxClient = influxClient;
        this.org          = org;
        this.token        = token;
        this.bucket       = bucket;
    }

    @Override
    public Mono<List<Double>> querySeries(VitalSignal signal, String deviceId, SeriesWindow window) {
        String flux = FluxQueryBuilder.series(bucket, deviceId, signal.storeField(), window);
        return queryRows(deviceId, flux)
            .map(FluxCsvParser::values)
            .doOnNext(values -> log.debug("Series fetched. deviceId={} signal={} samples={}",
                                          deviceId, signal, values.size()));
    }

    @Override
    public Mono<Optional<Double>> queryScalar(VitalSignal signal, String deviceId, PointWindow window) {
        String flux = FluxQueryBuilder.mean(bucket, deviceId, signal.storeField(), window);
        return queryRows(deviceId, flux)
            .map(rows -> FluxCsvParser.values(rows).stream().findFirst())
            .doOnNext(value -> log.debug("Point mean fetched. deviceId={} signal={} value={}",
                                         deviceId, signal, value.orElse(null)));
    }

    /**
     * Runs an arbitrary Flux script and returns the parsed CSV rows.
     *
     * @param deviceId device the query concerns; used only to label failures
     */
    public Mono<List<Map<String, String>>> queryRows(String deviceId, String flux) {
        if (token == null || token.isBlank()) {
            return Mono.error(new StoreUnavailableException(deviceId, "InfluxDB token is not configured"));
        }

        return influxClient.post()
            .uri(uriBuilder -> uriBuilder
                .path("/api/v2/query")
                .queryParam("org", org)
                .build())
            .header(HttpHeaders.AUTHORIZATION, "Token " + token)
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.parseMediaType("text/csv"))
            .bodyValue(Map.of("query", flux))
            .retrieve()
            .bodyToMono(String.class)
            .defaultIfEmpty("")
            .map(FluxCsvParser::parse)
            .onErrorMap(e -> !(e instanceof StoreUnavailableException),
                        e -> new StoreUnavailableException(deviceId, "InfluxDB query failed: " + e.getMessage(), e));
    }

    public String bucket() {
        return bucket;
    }
}
