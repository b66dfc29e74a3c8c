package com.powersentinel.core.history;

import com.powersentinel.core.model.FeatureRecord;

import java.util.function.ToDoubleFunction;

/**
 * Selects one numeric column of a {@link FeatureRecord}.
 *
 * @since 1.0.0
 */
public enum Metric {
    VOLTAGE("Voltage", "V", FeatureRecord::getVoltage),
    CURRENT("Current", "A", FeatureRecord::getCurrent),
    POWER("Power", "W", FeatureRecord::getPower),
    POWER_FACTOR("Power factor", "", FeatureRecord::getPowerFactor),
    EFFICIENCY("Efficiency", "%", FeatureRecord::getEfficiency);

    private final String displayName;
    private final String unit;
    private final ToDoubleFunction<FeatureRecord> selector;

    Metric(String displayName, String unit, ToDoubleFunction<FeatureRecord> selector) {
        this.displayName = displayName;
        this.unit = unit;
        this.selector = selector;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getUnit() {
        return unit;
    }

    public double valueOf(FeatureRecord record) {
        return selector.applyAsDouble(record);
    }
}
