package com.powersentinel.core.detection;

import com.powersentinel.core.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Creates the engine's detector chain from an {@link EngineConfig}.
 *
 * <p>
 * The order of the returned list is the order in which findings are reported:
 * statistical first, predictive last.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class — not instantiable
    }

    /**
     * @param config validated engine configuration; must not be {@code null}
     * @return unmodifiable detector chain
     */
    public static List<AnomalyDetector> createAll(EngineConfig config) {
        Objects.requireNonNull(config, "EngineConfig must not be null");
        List<AnomalyDetector> detectors = List.of(
                new StatisticalDetector(config.getWarmupSize(), config.getThresholds()),
                new PredictiveDetector(config.getMinTrainingSize(), config.getThresholds()));
        LOG.info("Created {} detector(s): {}", detectors.size(),
                detectors.stream().map(AnomalyDetector::getName).toList());
        return detectors;
    }
}
