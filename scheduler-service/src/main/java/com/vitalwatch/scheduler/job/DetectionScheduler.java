package com.vitalwatch.scheduler.job;

import com.vitalwatch.common.model.CycleResult;
import com.vitalwatch.scheduler.client.DetectorClient;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Fixed-period trigger for the drift detector, one independent loop per configured device:
 * <pre>
 *   delay(interval) → trigger cycle → wait for its result → repeat
 * </pre>
 *
 * <p>The alert trigger counts consecutive cycles, so the period must stay fixed: there is no
 * adaptive tempo and no catch-up after a slow cycle. The next cycle for a device is only
 * scheduled once the previous one has completed, which keeps at most one cycle in flight per
 * device.
 *
 * <p>Each cycle is a fresh {@link Mono}; {@code Mono.delay()} releases the thread while waiting.
 * The loop never stops on its own: a failed trigger is logged and the device is rescheduled
 * with the same interval.
 */
@Component
public class DetectionScheduler {

    private static final Logger log = LoggerFactory.getLogger(DetectionScheduler.class);

    private final DetectorClient detectorClient;

    @Value("${scheduler.devices:84F7035346E0}")
    private String devicesConfig;

    @Value("${scheduler.interval:1m}")
    private Duration interval;

    @Value("${scheduler.initial-delay:5s}")
    private Duration initialDelay;

    private volatile boolean running;

    public DetectionScheduler(DetectorClient detectorClient) {
        this.detectorClient = detectorClient;
    }

    @PostConstruct
    public void startScheduling() {
        List<String> devices = parseDevices(devicesConfig);
        if (devices.isEmpty()) {
            log.warn("No devices configured (scheduler.devices). Scheduler idle.");
            return;
        }
        running = true;
        log.info("Detection scheduler started. devices={} intervalSeconds={}", devices, interval.toSeconds());
        devices.forEach(device -> scheduleNextCycle(device, initialDelay));
    }

    @PreDestroy
    public void stop() {
        running = false;
        log.info("Detection scheduler stopped.");
    }

    private void scheduleNextCycle(String deviceId, Duration delay) {
        if (!running) {
            return;
        }
        Mono.delay(delay)
            .then(detectorClient.trigger(deviceId))
            .subscribe(
                this::logResult,
                err -> {
                    log.error("Scheduling cycle failed for deviceId={}. Rescheduling.", deviceId, err);
                    scheduleNextCycle(deviceId, interval);
                },
                () -> scheduleNextCycle(deviceId, interval)
            );
    }

    private void logResult(CycleResult result) {
        log.info("Cycle completed. deviceId={} traceId={} outcome={} hrCounter={} rrCounter={} alertFired={}",
                 result.deviceId(), result.traceId(), result.outcome(),
                 result.heartRateCounter(), result.respirationCounter(), result.alertFired());
    }

    /** Splits the comma list, trimming entries and dropping blanks and duplicates. */
    static List<String> parseDevices(String config) {
        if (config == null) {
            return List.of();
        }
        return Arrays.stream(config.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .distinct()
            .toList();
    }
}
