package com.powersentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Feature-engineered view of a {@link Sample}, as stored in the sliding
 * history and used for model training.
 *
 * <p>
 * {@code powerFactor = power / (voltage × current)} and
 * {@code efficiency = powerFactor × 100}. A zero apparent power
 * ({@code voltage × current == 0}) yields a power factor of {@code 0}.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double voltage;
    private final double current;
    private final double power;
    private final double powerFactor;
    private final double efficiency;

    private FeatureRecord(double voltage, double current, double power) {
        this.voltage = voltage;
        this.current = current;
        this.power = power;
        this.powerFactor = powerFactor(power, voltage, current);
        this.efficiency = powerFactor * 100.0;
    }

    /**
     * Engineer the features of a sample.
     *
     * @param sample the raw reading; must not be {@code null}
     * @return new feature record
     */
    public static FeatureRecord from(Sample sample) {
        Objects.requireNonNull(sample, "Sample must not be null");
        return new FeatureRecord(sample.getVoltage(), sample.getCurrent(), sample.getPower());
    }

    /**
     * Engineer the features of raw readings.
     *
     * @param voltage volts
     * @param current amperes
     * @param power   watts
     * @return new feature record
     */
    public static FeatureRecord of(double voltage, double current, double power) {
        return new FeatureRecord(voltage, current, power);
    }

    /**
     * Ratio of real to apparent power; {@code 0} when apparent power is zero
     * or too small for the ratio to be finite.
     *
     * @param power   watts
     * @param voltage volts
     * @param current amperes
     * @return the power factor
     */
    public static double powerFactor(double power, double voltage, double current) {
        double apparent = voltage * current;
        if (apparent == 0) {
            return 0;
        }
        double ratio = power / apparent;
        return Double.isFinite(ratio) ? ratio : 0;
    }

    public double getVoltage() {
        return voltage;
    }

    public double getCurrent() {
        return current;
    }

    public double getPower() {
        return power;
    }

    public double getPowerFactor() {
        return powerFactor;
    }

    public double getEfficiency() {
        return efficiency;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FeatureRecord that))
            return false;
        return Double.compare(voltage, that.voltage) == 0
                && Double.compare(current, that.current) == 0
                && Double.compare(power, that.power) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(voltage, current, power);
    }

    @Override
    public String toString() {
        return "FeatureRecord{" +
                "voltage=" + voltage +
                ", current=" + current +
                ", power=" + power +
                ", powerFactor=" + powerFactor +
                ", efficiency=" + efficiency +
                '}';
    }
}
