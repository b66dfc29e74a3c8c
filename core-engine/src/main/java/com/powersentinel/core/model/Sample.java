package com.powersentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single telemetry reading for one device.
 *
 * <p>
 * Instances are immutable. Readings must be finite; the transport layer is
 * expected to reject anything else before it reaches the engine, and the
 * constructor enforces it again.
 * </p>
 *
 * @since 1.0.0
 */
public final class Sample implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String deviceId;
    private final Instant timestamp;
    private final double voltage;
    private final double current;
    private final double power;

    /**
     * @param deviceId  device identifier; must not be {@code null}
     * @param timestamp reading time; must not be {@code null}
     * @param voltage   volts
     * @param current   amperes
     * @param power     watts
     * @throws NullPointerException     if {@code deviceId} or {@code timestamp}
     *                                  is {@code null}
     * @throws IllegalArgumentException if any reading is NaN or infinite
     */
    public Sample(String deviceId, Instant timestamp, double voltage, double current, double power) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.voltage = requireFinite(voltage, "voltage");
        this.current = requireFinite(current, "current");
        this.power = requireFinite(power, "power");
    }

    public String getDeviceId() {
        return deviceId;
    }

    public Instant getTimestamp() {
        return timestamp;
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

    private static double requireFinite(double value, String name) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be finite, got: " + value);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Sample that))
            return false;
        return Double.compare(voltage, that.voltage) == 0
                && Double.compare(current, that.current) == 0
                && Double.compare(power, that.power) == 0
                && deviceId.equals(that.deviceId)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, timestamp, voltage, current, power);
    }

    @Override
    public String toString() {
        return "Sample{" +
                "deviceId='" + deviceId + '\'' +
                ", timestamp=" + timestamp +
                ", voltage=" + voltage +
                ", current=" + current +
                ", power=" + power +
                '}';
    }
}
