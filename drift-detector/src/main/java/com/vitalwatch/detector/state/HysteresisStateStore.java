package com.vitalwatch.detector.state;

import com.vitalwatch.common.model.DetectionConfig;
import com.vitalwatch.common.model.DeviceHysteresisState;
import com.vitalwatch.common.policy.DetectionCyclePolicy.CycleStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * In-memory owner of every device's hysteresis counter pair, one entry per device id.
 *
 * <p>{@link #commit} is the single commit point of a detection cycle: the read of the prior
 * counters, the judgment and the write of the new counters run inside one
 * {@link ConcurrentHashMap#compute} call, so the update is atomic per device. Different
 * devices never share an entry and commit independently.
 *
 * <p>Devices never seen before start at zero with the configured trigger threshold.
 */
@Component
public class HysteresisStateStore {

    private static final Logger log = LoggerFactory.getLogger(HysteresisStateStore.class);

    private final ConcurrentHashMap<String, DeviceHysteresisState> store = new ConcurrentHashMap<>();
    private final int triggerThreshold;

    public HysteresisStateStore(DetectionConfig detectionConfig) {
        this.triggerThreshold = detectionConfig.triggerThreshold();
    }

    /** Current counters for {@code deviceId}; zeroed state for an unknown device. Never mutates. */
    public DeviceHysteresisState current(String deviceId) {
        DeviceHysteresisState state = store.get(deviceId);
        return state != null ? state : DeviceHysteresisState.initial(triggerThreshold);
    }

    /**
     * Atomically applies one cycle's judgment to the device's counters.
     *
     * @param step computes the cycle result and next counters from the prior counters;
     *             must be pure, it runs under the per-device lock
     * @return the step produced for this commit
     */
    public CycleStep commit(String deviceId, Function<DeviceHysteresisState, CycleStep> step) {
        final CycleStep[] committed = {null};
        store.compute(deviceId, (id, prior) -> {
            CycleStep result = step.apply(prior != null ? prior : DeviceHysteresisState.initial(triggerThreshold));
            committed[0] = result;
            return result.next();
        });
        return committed[0];
    }

    /**
     * Seeds a device's counters restored from persistent storage. Applied only when the device
     * has no in-memory entry yet: once a live cycle has committed, its counters win, whatever
     * their value.
     *
     * @return true when the restored counters were installed
     */
    public boolean restore(String deviceId, DeviceHysteresisState restored) {
        DeviceHysteresisState live = store.putIfAbsent(deviceId, restored);
        if (live != null) {
            log.info("HYSTERESIS_RESTORE_SKIPPED deviceId={} live state present", deviceId);
            return false;
        }
        log.info("HYSTERESIS_RESTORED deviceId={} hrCounter={} rrCounter={}",
                 deviceId, restored.heartRate().counter(), restored.respiration().counter());
        return true;
    }

    /** Read-only copy of all known devices and their counters. */
    public Map<String, DeviceHysteresisState> snapshot() {
        return Map.copyOf(store);
    }
}
