package com.powersentinel.service;

import com.powersentinel.core.config.EngineConfig;
import com.powersentinel.core.config.EngineConfigLoader;
import com.powersentinel.core.engine.AnomalyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Main entry point for the Power Sentinel service.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   stdin (one JSON sample per line)
 *     → TelemetryDispatcher
 *     → AnomalyEngine (shared, all devices)
 *     → JsonLinesAlertSink (stdout)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Service settings come from environment variables via {@link ServiceConfig};
 * engine settings from YAML via {@link EngineConfigLoader}. Logs go to
 * standard error so that standard output carries only alerts.
 * </p>
 *
 * @since 1.0.0
 */
public final class PowerSentinelApp {

    private static final Logger LOG = LoggerFactory.getLogger(PowerSentinelApp.class);

    private PowerSentinelApp() {
        // entry-point class — not instantiable
    }

    public static void main(String[] args) {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting Power Sentinel with config: {}", config);
        EngineConfig engineConfig = loadEngineConfig(config);

        // 2. Build the engine and the dispatch path
        AnomalyEngine engine = new AnomalyEngine(engineConfig);
        TelemetryDispatcher dispatcher = new TelemetryDispatcher(
                engine, new SampleDecoder(), new JsonLinesAlertSink(System.out), config.getStatusLogInterval());

        // 3. Start health server with shutdown hook
        HealthServer healthServer = new HealthServer(engine::status);
        healthServer.start(config.getHealthPort());
        Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

        // 4. Feed samples until the input is exhausted
        try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            long lines = pump(in, dispatcher);
            LOG.info("Input exhausted after {} line(s): processed={} dropped={} alerted={}",
                    lines, dispatcher.getProcessedCount(), dispatcher.getDroppedCount(),
                    dispatcher.getAlertedCount());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read telemetry from standard input", e);
        } finally {
            engine.close();
            healthServer.stop();
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /**
     * Dispatch every non-blank line of {@code in}.
     *
     * @return number of non-blank lines read
     */
    static long pump(BufferedReader in, TelemetryDispatcher dispatcher) throws IOException {
        long lines = 0;
        String line;
        while ((line = in.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            lines++;
            dispatcher.dispatch(line);
        }
        return lines;
    }

    static EngineConfig loadEngineConfig(ServiceConfig config) {
        String path = config.getEngineConfigPath();
        if (path != null && !path.isBlank()) {
            return EngineConfigLoader.fromFile(path);
        }
        return EngineConfigLoader.load();
    }
}
