package com.vitalwatch.common.model;

/**
 * The two physiological signals a monitored device reports.
 *
 * <p>Each signal carries the field name under which the sensor gateway writes it to the
 * time-series store, and a short label used in log lines and alert messages.
 */
public enum VitalSignal {

    HEART_RATE("heart_rate_bpm", "HR"),
    RESPIRATION("respiration_bpm", "RR");

    private final String storeField;
    private final String label;

    VitalSignal(String storeField, String label) {
        this.storeField = storeField;
        this.label      = label;
    }

    public String storeField() {
        return storeField;
    }

    public String label() {
        return label;
    }
}
