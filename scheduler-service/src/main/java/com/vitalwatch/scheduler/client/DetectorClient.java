package com.vitalwatch.scheduler.client;

import com.vitalwatch.common.event.DetectionEvent;
import com.vitalwatch.common.model.CycleResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.UUID;

/**
 * Asks drift-detector to run one detection cycle for a device.
 *
 * <p>All errors are absorbed (logged, completes empty) so that a scheduling loop never stalls
 * if drift-detector is unreachable.
 */
@Component
public class DetectorClient {

    private static final Logger log = LoggerFactory.getLogger(DetectorClient.class);

    private final WebClient detectorWebClient;

    public DetectorClient(WebClient detectorWebClient) {
        this.detectorWebClient = detectorWebClient;
    }

    /**
     * @param deviceId device to evaluate
     * @return the cycle result, or empty when the call failed
     */
    public Mono<CycleResult> trigger(String deviceId) {
        return Mono.defer(() -> {
            String traceId = UUID.randomUUID().toString();
            DetectionEvent event = new DetectionEvent(deviceId, Instant.now(), traceId);
            log.info("Triggering detection cycle. deviceId={} traceId={}", deviceId, traceId);

            return detectorWebClient.post()
                .uri("/api/v1/detect/trigger")
                .header("X-Trace-Id", traceId)
                .bodyValue(event)
                .retrieve()
                .bodyToMono(CycleResult.class)
                .onErrorResume(e -> {
                    log.error("Detector call failed. deviceId={} traceId={} reason={}",
                              deviceId, traceId, e.getMessage());
                    return Mono.empty();
                });
        });
    }
}
