package com.vitalwatch.detector.publisher;

import com.vitalwatch.common.alert.AlertPublisher;
import com.vitalwatch.common.model.CycleResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * REST-based implementation of {@link AlertPublisher}.
 *
 * <p>Sends every {@link CycleResult} to notification-service via HTTP POST (fire-and-forget).
 * Delivery failures are logged and dropped; the next cycle publishes a fresh result anyway.
 */
@Component
public class RestAlertPublisher implements AlertPublisher {

    private static final Logger log = LoggerFactory.getLogger(RestAlertPublisher.class);

    private final WebClient notificationClient;

    public RestAlertPublisher(WebClient notificationClient) {
        this.notificationClient = notificationClient;
    }

    @Override
    public void publish(CycleResult result) {
        notificationClient.post()
            .uri("/api/v1/notify/cycle")
            .header("X-Trace-Id", result.traceId())
            .bodyValue(result)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Cycle result published. traceId={} deviceId={} outcome={} alertFired={} status={}",
                                result.traceId(), result.deviceId(), result.outcome(),
                                result.alertFired(), r.getStatusCode()),
                err -> log.warn("Cycle result publish failed (non-critical). traceId={} deviceId={}",
                                result.traceId(), result.deviceId(), err)
            );
    }
}
