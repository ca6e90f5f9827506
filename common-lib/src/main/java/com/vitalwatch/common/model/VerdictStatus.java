package com.vitalwatch.common.model;

/**
 * Per-signal classification produced once per detection cycle.
 *
 * <ul>
 *   <li>{@link #NORMAL}            — short and long windows agree within both thresholds.</li>
 *   <li>{@link #ANOMALOUS}         — absolute OR relative deviation exceeds its threshold.</li>
 *   <li>{@link #INSUFFICIENT_DATA} — one of the two aggregates is missing while the signal is
 *       otherwise reporting.</li>
 *   <li>{@link #NO_RECENT_DATA}    — neither window holds any sample; the signal is silent.</li>
 * </ul>
 *
 * <p>Only {@link #ANOMALOUS} advances a hysteresis counter; every other status resets it.
 */
public enum VerdictStatus {
    NORMAL,
    ANOMALOUS,
    INSUFFICIENT_DATA,
    NO_RECENT_DATA
}
