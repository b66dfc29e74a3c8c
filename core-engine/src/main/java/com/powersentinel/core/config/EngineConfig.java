package com.powersentinel.core.config;

import com.powersentinel.core.history.SlidingHistory;
import com.powersentinel.core.prediction.PowerPredictor;
import com.powersentinel.core.prediction.QuadraticRidgeRegression;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the engine YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key optional):
 * </p>
 *
 * <pre>
 * historyCapacity: 1000
 * warmupSize: 10
 * minTrainingSize: 50
 * retrainIntervalMinutes: 30
 * asyncRetraining: true
 * ridgePenalty: 1.0e-6
 * thresholds:
 *   zscore: 2.5
 *   zscoreHigh: 3.5
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private int historyCapacity = SlidingHistory.DEFAULT_CAPACITY;

    /** Minimum history size before statistical detection engages. */
    private int warmupSize = 10;

    private int minTrainingSize = PowerPredictor.DEFAULT_MIN_TRAINING_SIZE;

    private long retrainIntervalMinutes = 30;

    /** Fit models on a background thread instead of inside {@code ingest}. */
    private boolean asyncRetraining = true;

    private double ridgePenalty = QuadraticRidgeRegression.DEFAULT_PENALTY;

    private DetectionThresholds thresholds = new DetectionThresholds();

    /**
     * Validate every value, collecting all errors before failing.
     *
     * @throws IllegalStateException if one or more values are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (historyCapacity < 1) {
            errors.add("historyCapacity must be >= 1, got: " + historyCapacity);
        }
        if (warmupSize < 2) {
            errors.add("warmupSize must be >= 2, got: " + warmupSize);
        }
        if (minTrainingSize < 2) {
            errors.add("minTrainingSize must be >= 2, got: " + minTrainingSize);
        }
        if (minTrainingSize > historyCapacity) {
            errors.add("minTrainingSize (" + minTrainingSize
                    + ") must not exceed historyCapacity (" + historyCapacity + ")");
        }
        if (retrainIntervalMinutes < 0) {
            errors.add("retrainIntervalMinutes must be >= 0, got: " + retrainIntervalMinutes);
        }
        if (!(ridgePenalty > 0)) {
            errors.add("ridgePenalty must be > 0, got: " + ridgePenalty);
        }
        if (thresholds == null) {
            errors.add("thresholds must not be null");
        } else {
            thresholds.collectErrors(errors);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Engine configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    public Duration getRetrainInterval() {
        return Duration.ofMinutes(retrainIntervalMinutes);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public void setHistoryCapacity(int historyCapacity) {
        this.historyCapacity = historyCapacity;
    }

    public int getWarmupSize() {
        return warmupSize;
    }

    public void setWarmupSize(int warmupSize) {
        this.warmupSize = warmupSize;
    }

    public int getMinTrainingSize() {
        return minTrainingSize;
    }

    public void setMinTrainingSize(int minTrainingSize) {
        this.minTrainingSize = minTrainingSize;
    }

    public long getRetrainIntervalMinutes() {
        return retrainIntervalMinutes;
    }

    public void setRetrainIntervalMinutes(long retrainIntervalMinutes) {
        this.retrainIntervalMinutes = retrainIntervalMinutes;
    }

    public boolean isAsyncRetraining() {
        return asyncRetraining;
    }

    public void setAsyncRetraining(boolean asyncRetraining) {
        this.asyncRetraining = asyncRetraining;
    }

    public double getRidgePenalty() {
        return ridgePenalty;
    }

    public void setRidgePenalty(double ridgePenalty) {
        this.ridgePenalty = ridgePenalty;
    }

    public DetectionThresholds getThresholds() {
        return thresholds;
    }

    public void setThresholds(DetectionThresholds thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "historyCapacity=" + historyCapacity +
                ", warmupSize=" + warmupSize +
                ", minTrainingSize=" + minTrainingSize +
                ", retrainIntervalMinutes=" + retrainIntervalMinutes +
                ", asyncRetraining=" + asyncRetraining +
                ", ridgePenalty=" + ridgePenalty +
                ", thresholds=" + thresholds +
                '}';
    }
}
