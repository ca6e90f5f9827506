package com.vitalwatch.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record DetectionEvent(
    @JsonProperty("deviceId") String deviceId,
    @JsonProperty("triggeredAt") Instant triggeredAt,
    @JsonProperty("traceId") String traceId
) {}
