package com.powersentinel.service;

import com.powersentinel.core.config.EngineConfig;
import com.powersentinel.core.engine.AnomalyEngine;
import com.powersentinel.core.model.DetectionMethod;
import com.powersentinel.core.model.FindingKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TelemetryDispatcher} wired to a real engine.
 */
class TelemetryDispatcherTest {

    private AnomalyEngine engine;
    private List<DeviceAlert> published;

    @BeforeEach
    void setUp() {
        EngineConfig config = new EngineConfig();
        config.setAsyncRetraining(false);
        engine = new AnomalyEngine(config);
        published = new ArrayList<>();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    @DisplayName("Should publish one alert per finding for a power spike")
    void shouldPublishAlertsForSpike() {
        TelemetryDispatcher dispatcher = new TelemetryDispatcher(engine, new SampleDecoder(), published::add, 100);
        for (int i = 0; i < 20; i++) {
            assertThat(dispatcher.dispatch(payload("meter-1", 230, 1, 100))).isEmpty();
        }

        List<DeviceAlert> alerts = dispatcher.dispatch(payload("meter-1", 230, 1, 1000));

        assertThat(alerts).isNotEmpty();
        assertThat(alerts.get(0).getType()).isEqualTo(FindingKind.POWER_ANOMALY);
        assertThat(alerts.get(0).getMethod()).isEqualTo(DetectionMethod.Z_SCORE);
        assertThat(alerts).allMatch(a -> a.getDeviceId().equals("meter-1"));
        assertThat(published).containsExactlyElementsOf(alerts);
        assertThat(dispatcher.getProcessedCount()).isEqualTo(21);
        assertThat(dispatcher.getAlertedCount()).isEqualTo(alerts.size());
    }

    @Test
    @DisplayName("Should count and skip malformed payloads without touching the engine")
    void shouldDropMalformedPayloads() {
        TelemetryDispatcher dispatcher = new TelemetryDispatcher(engine, new SampleDecoder(), published::add, 100);

        assertThat(dispatcher.dispatch("{\"deviceId\":\"m\"}")).isEmpty();
        assertThat(dispatcher.dispatch("garbage")).isEmpty();

        assertThat(dispatcher.getDroppedCount()).isEqualTo(2);
        assertThat(dispatcher.getProcessedCount()).isZero();
        assertThat(engine.status().getHistorySize()).isZero();
    }

    @Test
    @DisplayName("A failing sink should not stop processing")
    void shouldSurviveFailingSink() {
        AlertSink failing = alert -> {
            throw new IllegalStateException("broadcast channel closed");
        };
        TelemetryDispatcher dispatcher = new TelemetryDispatcher(engine, new SampleDecoder(), failing, 5);
        for (int i = 0; i < 20; i++) {
            dispatcher.dispatch(payload("meter-1", 230, 1, 100));
        }

        List<DeviceAlert> alerts = dispatcher.dispatch(payload("meter-1", 230, 1, 1000));
        dispatcher.dispatch(payload("meter-1", 230, 1, 100));

        assertThat(alerts).isNotEmpty();
        assertThat(dispatcher.getAlertedCount()).isZero();
        assertThat(dispatcher.getProcessedCount()).isEqualTo(22);
        assertThat(engine.status().getHistorySize()).isEqualTo(22);
    }

    @Test
    @DisplayName("Should pump every non-blank line from a reader")
    void shouldPumpLines() throws Exception {
        TelemetryDispatcher dispatcher = new TelemetryDispatcher(engine, new SampleDecoder(), published::add, 100);
        String input = payload("a", 230, 5, 1150) + "\n\n"
                + "{broken\n"
                + payload("b", 231, 5, 1155) + "\n";

        long lines = PowerSentinelApp.pump(new BufferedReader(new StringReader(input)), dispatcher);

        assertThat(lines).isEqualTo(3);
        assertThat(dispatcher.getProcessedCount()).isEqualTo(2);
        assertThat(dispatcher.getDroppedCount()).isEqualTo(1);
    }

    private static String payload(String deviceId, double voltage, double current, double power) {
        return String.format(Locale.ROOT,
                "{\"deviceId\":\"%s\",\"voltage\":%.2f,\"current\":%.2f,\"power\":%.2f}",
                deviceId, voltage, current, power);
    }
}
