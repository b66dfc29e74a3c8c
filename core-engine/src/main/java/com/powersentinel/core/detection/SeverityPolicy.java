package com.powersentinel.core.detection;

import com.powersentinel.core.config.DetectionThresholds;
import com.powersentinel.core.model.DetectionMethod;
import com.powersentinel.core.model.Severity;

import java.util.Objects;

/**
 * Maps a detection score to a {@link Severity} tier.
 *
 * <p>
 * Pure and stateless apart from the thresholds it was built with, so
 * thresholds can be tuned without touching detection logic. A score that does
 * not reach the firing threshold of its method classifies as
 * {@link Severity#LOW}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeverityPolicy {

    private final DetectionThresholds thresholds;

    public SeverityPolicy(DetectionThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "DetectionThresholds must not be null");
    }

    /**
     * Classify a score of the given method.
     *
     * @param method the detection method; must not be {@code null}
     * @param score  the method's score (z-score, fence distance or relative
     *               error)
     * @param scale  the IQR for {@link DetectionMethod#IQR}; ignored otherwise
     * @return the severity tier
     */
    public Severity classify(DetectionMethod method, double score, double scale) {
        Objects.requireNonNull(method, "DetectionMethod must not be null");
        return switch (method) {
            case Z_SCORE -> forZscore(score);
            case IQR -> forFenceDistance(score, scale);
            case PREDICTIVE -> forRelativeError(score);
        };
    }

    public Severity forZscore(double z) {
        if (z > thresholds.getZscoreHigh()) {
            return Severity.HIGH;
        }
        return z > thresholds.getZscore() ? Severity.MEDIUM : Severity.LOW;
    }

    /**
     * @param distance distance beyond the nearest IQR fence; {@code 0} inside
     * @param iqr      the interquartile range the fences were built from
     */
    public Severity forFenceDistance(double distance, double iqr) {
        if (distance <= 0) {
            return Severity.LOW;
        }
        return distance > thresholds.getIqrHighFactor() * iqr ? Severity.HIGH : Severity.MEDIUM;
    }

    public Severity forRelativeError(double relativeError) {
        if (relativeError > thresholds.getRelativeErrorHigh()) {
            return Severity.HIGH;
        }
        return relativeError > thresholds.getRelativeError() ? Severity.MEDIUM : Severity.LOW;
    }
}
