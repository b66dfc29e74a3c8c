package com.powersentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What kind of abnormal reading a {@link Finding} reports.
 *
 * @since 1.0.0
 */
public enum FindingKind {
    VOLTAGE_ANOMALY("Voltage Anomaly"),
    CURRENT_ANOMALY("Current Anomaly"),
    POWER_ANOMALY("Power Anomaly"),
    POWER_OUTLIER("Power Outlier"),
    POWER_PREDICTION_ANOMALY("Power Prediction Anomaly");

    private final String label;

    FindingKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
