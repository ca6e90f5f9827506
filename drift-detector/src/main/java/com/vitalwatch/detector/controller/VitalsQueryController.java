package com.vitalwatch.detector.controller;

import com.vitalwatch.common.exception.StoreUnavailableException;
import com.vitalwatch.detector.dto.VitalsQueryRequest;
import com.vitalwatch.detector.service.VitalsQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/vitals")
public class VitalsQueryController {

    private static final Logger log = LoggerFactory.getLogger(VitalsQueryController.class);

    private final VitalsQueryService queryService;

    public VitalsQueryController(VitalsQueryService queryService) {
        this.queryService = queryService;
    }

    @PostMapping("/query")
    public Mono<ResponseEntity<Map<String, Object>>> query(@RequestBody VitalsQueryRequest request) {
        return queryService.query(request)
            .map(rows -> ResponseEntity.ok(Map.<String, Object>of("results", rows)))
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.warn("Rejected vitals query: {}", e.getMessage());
                return Mono.just(ResponseEntity.badRequest().body(Map.of("error", e.getMessage())));
            })
            .onErrorResume(StoreUnavailableException.class, e -> {
                log.error("Vitals query failed: {}", e.getMessage());
                return Mono.just(ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(Map.of("error", e.getMessage())));
            });
    }
}
