package com.vitalwatch.detector.controller;

import com.vitalwatch.common.event.DetectionEvent;
import com.vitalwatch.common.model.CycleResult;
import com.vitalwatch.common.model.DeviceHysteresisState;
import com.vitalwatch.detector.service.DetectionCycleService;
import com.vitalwatch.detector.state.HysteresisStateStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/detect")
public class DetectionController {

    private final DetectionCycleService cycleService;
    private final HysteresisStateStore stateStore;

    @Value("${detector.device-id:84F7035346E0}")
    private String defaultDeviceId;

    public DetectionController(DetectionCycleService cycleService, HysteresisStateStore stateStore) {
        this.cycleService = cycleService;
        this.stateStore   = stateStore;
    }

    /** Runs one cycle. Missing device id, trace id or timestamp are filled in. */
    @PostMapping("/trigger")
    public Mono<ResponseEntity<CycleResult>> trigger(
            @RequestBody(required = false) DetectionEvent event,
            @RequestHeader(value = "X-Trace-Id", required = false) String traceHeader) {
        return cycleService.runCycle(complete(event, traceHeader)).map(ResponseEntity::ok);
    }

    @GetMapping("/state/{deviceId}")
    public ResponseEntity<DeviceHysteresisState> state(@PathVariable String deviceId) {
        return ResponseEntity.ok(stateStore.current(deviceId));
    }

    @GetMapping("/state")
    public ResponseEntity<Map<String, DeviceHysteresisState>> states() {
        return ResponseEntity.ok(stateStore.snapshot());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    DetectionEvent complete(DetectionEvent event, String traceHeader) {
        String deviceId = event != null && hasText(event.deviceId()) ? event.deviceId() : defaultDeviceId;
        Instant at      = event != null && event.triggeredAt() != null ? event.triggeredAt() : Instant.now();
        String traceId;
        if (event != null && hasText(event.traceId())) {
            traceId = event.traceId();
        } else if (hasText(traceHeader)) {
            traceId = traceHeader;
        } else {
            traceId = UUID.randomUUID().toString();
        }
        return new DetectionEvent(deviceId, at, traceId);
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
