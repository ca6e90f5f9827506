package com.vitalwatch.detector.state;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Persisted consecutive-anomaly counter: one row per (device, signal).
 *
 * <p>Written after every committed cycle when persistence is enabled, and read back once at
 * startup so a restart does not silently drop a streak in progress.
 */
@Data
@NoArgsConstructor
@Table("hysteresis_counters")
public class SignalCounter {

    @Id
    private Long id;

    private String deviceId;
    private String signal;
    private int counter;

    private LocalDateTime updatedAt;
}
