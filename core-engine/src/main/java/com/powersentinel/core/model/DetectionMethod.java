package com.powersentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Technique that produced a {@link Finding}.
 *
 * @since 1.0.0
 */
public enum DetectionMethod {
    Z_SCORE("Z-Score"),
    IQR("IQR"),
    PREDICTIVE("Predictive");

    private final String label;

    DetectionMethod(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
