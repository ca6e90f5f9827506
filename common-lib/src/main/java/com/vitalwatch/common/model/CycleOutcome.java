package com.vitalwatch.common.model;

/**
 * How a detection cycle ended.
 *
 * <ul>
 *   <li>{@link #EVALUATED}         — verdicts computed and committed to the hysteresis state.</li>
 *   <li>{@link #DEVICE_OFFLINE}    — both signals silent; no judgment, state untouched.</li>
 *   <li>{@link #STORE_UNAVAILABLE} — the sample store failed to answer; cycle aborted, state untouched.</li>
 * </ul>
 */
public enum CycleOutcome {
    EVALUATED,
    DEVICE_OFFLINE,
    STORE_UNAVAILABLE
}
