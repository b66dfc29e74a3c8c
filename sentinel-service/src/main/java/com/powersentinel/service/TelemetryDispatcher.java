package com.powersentinel.service;

import com.powersentinel.core.engine.AnomalyEngine;
import com.powersentinel.core.model.EngineStatus;
import com.powersentinel.core.model.Finding;
import com.powersentinel.core.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives one telemetry payload through the engine and publishes the result.
 *
 * <h3>Flow</h3>
 *
 * <pre>
 *   raw JSON
 *     → SampleDecoder (malformed payloads dropped)
 *     → AnomalyEngine.ingest
 *     → one DeviceAlert per finding
 *     → AlertSink
 * </pre>
 *
 * <p>
 * A failing sink is logged per alert and does not stop processing. Every
 * {@code statusLogInterval} processed samples the engine status is logged.
 * Safe to call from several threads; the engine serialises ingestion.
 * </p>
 *
 * @since 1.0.0
 */
public class TelemetryDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(TelemetryDispatcher.class);

    private final AnomalyEngine engine;
    private final SampleDecoder decoder;
    private final AlertSink sink;
    private final int statusLogInterval;

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong alerted = new AtomicLong();

    public TelemetryDispatcher(AnomalyEngine engine, SampleDecoder decoder, AlertSink sink, int statusLogInterval) {
        this.engine = Objects.requireNonNull(engine, "AnomalyEngine must not be null");
        this.decoder = Objects.requireNonNull(decoder, "SampleDecoder must not be null");
        this.sink = Objects.requireNonNull(sink, "AlertSink must not be null");
        if (statusLogInterval < 1) {
            throw new IllegalArgumentException("statusLogInterval must be >= 1, got: " + statusLogInterval);
        }
        this.statusLogInterval = statusLogInterval;
    }

    // ---------------------------------------------------------------
    // Dispatch
    // ---------------------------------------------------------------

    /**
     * @param payload raw JSON text of one sample
     * @return alerts raised for the sample, empty if none or if dropped
     */
    public List<DeviceAlert> dispatch(String payload) {
        return dispatch(payload == null ? null : payload.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @param payload raw JSON bytes of one sample
     * @return alerts raised for the sample, empty if none or if dropped
     */
    public List<DeviceAlert> dispatch(byte[] payload) {
        Optional<Sample> decoded = decoder.decode(payload);
        if (decoded.isEmpty()) {
            dropped.incrementAndGet();
            return List.of();
        }
        return dispatch(decoded.get());
    }

    /**
     * @param sample an already validated sample
     * @return alerts raised for the sample
     */
    public List<DeviceAlert> dispatch(Sample sample) {
        Objects.requireNonNull(sample, "Sample must not be null");
        List<Finding> findings = engine.ingest(sample);

        List<DeviceAlert> alerts = new ArrayList<>(findings.size());
        for (Finding finding : findings) {
            DeviceAlert alert = DeviceAlert.of(sample, finding);
            alerts.add(alert);
            try {
                sink.publish(alert);
                alerted.incrementAndGet();
                LOG.info("Alert fired: device={} method={} severity={} – {}",
                        alert.getDeviceId(), alert.getMethod().label(), alert.getSeverity().label(),
                        alert.getMessage());
            } catch (RuntimeException e) {
                LOG.error("Alert sink failed for device {} – continuing", alert.getDeviceId(), e);
            }
        }

        long count = processed.incrementAndGet();
        if (count % statusLogInterval == 0) {
            logStatus(count);
        }
        return alerts;
    }

    // ---------------------------------------------------------------
    // Counters
    // ---------------------------------------------------------------

    public long getProcessedCount() {
        return processed.get();
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public long getAlertedCount() {
        return alerted.get();
    }

    private void logStatus(long count) {
        EngineStatus status = engine.status();
        LOG.info("Engine status after {} sample(s): historySize={} modelTrained={} lastTrained={} dropped={} alerted={}",
                count, status.getHistorySize(), status.isModelTrained(),
                status.lastTrained().map(Object::toString).orElse("never"), dropped.get(), alerted.get());
    }
}
