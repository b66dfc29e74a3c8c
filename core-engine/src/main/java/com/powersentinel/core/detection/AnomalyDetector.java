package com.powersentinel.core.detection;

import com.powersentinel.core.model.Finding;
import com.powersentinel.core.model.Sample;

import java.util.List;

/**
 * Contract for the engine's detectors.
 *
 * <p>
 * Detectors hold no per-sample state; everything they read comes from the
 * {@link DetectionContext}, which the engine guarantees is not mutated while
 * {@link #evaluate} runs.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Evaluate a sample against the current engine state.
     *
     * @param sample  the incoming reading
     * @param context history and predictor as of this sample
     * @return findings in emission order, empty when nothing fires
     */
    List<Finding> evaluate(Sample sample, DetectionContext context);

    /**
     * @return short name used in logs
     */
    String getName();
}
