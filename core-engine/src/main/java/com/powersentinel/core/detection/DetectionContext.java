package com.powersentinel.core.detection;

import com.powersentinel.core.history.SlidingHistory;
import com.powersentinel.core.prediction.PowerPredictor;

import java.util.Objects;

/**
 * Engine state visible to detectors while one sample is evaluated.
 *
 * @since 1.0.0
 */
public final class DetectionContext {

    private final SlidingHistory history;
    private final PowerPredictor predictor;

    public DetectionContext(SlidingHistory history, PowerPredictor predictor) {
        this.history = Objects.requireNonNull(history, "SlidingHistory must not be null");
        this.predictor = Objects.requireNonNull(predictor, "PowerPredictor must not be null");
    }

    public SlidingHistory history() {
        return history;
    }

    public PowerPredictor predictor() {
        return predictor;
    }
}
