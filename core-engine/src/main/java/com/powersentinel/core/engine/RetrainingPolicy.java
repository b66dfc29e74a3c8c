package com.powersentinel.core.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides when the power model is due for a (re)fit.
 *
 * <p>
 * A fit is due when the history holds at least {@code minTrainingSize}
 * records and either no model was ever trained or at least
 * {@code retrainInterval} has elapsed since the last successful fit.
 * </p>
 *
 * @since 1.0.0
 */
public final class RetrainingPolicy {

    private final int minTrainingSize;
    private final Duration retrainInterval;

    public RetrainingPolicy(int minTrainingSize, Duration retrainInterval) {
        this.retrainInterval = Objects.requireNonNull(retrainInterval, "retrainInterval must not be null");
        if (retrainInterval.isNegative()) {
            throw new IllegalArgumentException("retrainInterval must not be negative, got: " + retrainInterval);
        }
        this.minTrainingSize = minTrainingSize;
    }

    /**
     * @param historySize current number of history records
     * @param lastTrained instant of the last successful fit, empty if never
     * @param now         the current instant
     * @return {@code true} if a fit should be started now
     */
    public boolean isDue(int historySize, Optional<Instant> lastTrained, Instant now) {
        if (historySize < minTrainingSize) {
            return false;
        }
        return lastTrained
                .map(last -> Duration.between(last, now).compareTo(retrainInterval) >= 0)
                .orElse(true);
    }

    public int getMinTrainingSize() {
        return minTrainingSize;
    }

    public Duration getRetrainInterval() {
        return retrainInterval;
    }
}
