package com.powersentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Urgency tier of a {@link Finding}.
 *
 * @since 1.0.0
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * @return lowercase label used on the wire ({@code low}, {@code medium},
     *         {@code high})
     */
    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
