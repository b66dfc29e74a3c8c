package com.powersentinel.service;

/**
 * Destination for alerts raised by the engine.
 *
 * <p>
 * Implementations publish to whatever fans alerts out to observers. A sink
 * that throws only loses the alert at hand; dispatching carries on.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface AlertSink {

    /**
     * @param alert the alert to publish; never {@code null}
     */
    void publish(DeviceAlert alert);
}
