package com.vitalwatch.scheduler.client;

import com.vitalwatch.common.model.CycleOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class DetectorClientTest {

    private static final String RESULT_JSON = """
        {"deviceId":"84F7035346E0","traceId":"t-1","evaluatedAt":"2024-05-01T00:00:00Z",
         "outcome":"DEVICE_OFFLINE","heartRate":null,"respiration":null,
         "heartRateCounter":1,"respirationCounter":0,"triggerThreshold":3,
         "alertFired":false,"failureReason":null}
        """;

    @Test
    @DisplayName("posts a trigger with a trace id and returns the cycle result")
    void triggers() {
        AtomicReference<ClientRequest> seen = new AtomicReference<>();
        WebClient webClient = WebClient.builder()
            .baseUrl("http://detector.test")
            .exchangeFunction(request -> {
                seen.set(request);
                return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(RESULT_JSON)
                    .build());
            })
            .build();

        StepVerifier.create(new DetectorClient(webClient).trigger("84F7035346E0"))
            .assertNext(result -> {
                assertEquals(CycleOutcome.DEVICE_OFFLINE, result.outcome());
                assertEquals(1, result.heartRateCounter());
            })
            .verifyComplete();

        assertEquals("/api/v1/detect/trigger", seen.get().url().getPath());
        assertNotNull(seen.get().headers().getFirst("X-Trace-Id"));
    }

    @Test
    @DisplayName("an unreachable detector completes empty instead of failing")
    void absorbsErrors() {
        WebClient webClient = WebClient.builder()
            .exchangeFunction(request -> Mono.error(new IllegalStateException("Connection refused")))
            .build();

        StepVerifier.create(new DetectorClient(webClient).trigger("84F7035346E0"))
            .verifyComplete();
    }
}
