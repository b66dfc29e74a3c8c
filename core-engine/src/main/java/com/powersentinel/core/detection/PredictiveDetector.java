package com.powersentinel.core.detection;

import com.powersentinel.core.config.DetectionThresholds;
import com.powersentinel.core.model.DetectionMethod;
import com.powersentinel.core.model.Finding;
import com.powersentinel.core.model.FindingKind;
import com.powersentinel.core.model.Sample;
import com.powersentinel.core.prediction.ModelNotReadyException;
import com.powersentinel.core.prediction.PowerPredictor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Flags readings whose power deviates from the model's prediction.
 *
 * <p>
 * {@code relativeError = |actual - predicted| / max(predicted, floor)}. The
 * detector engages only when a model is live and the history holds at least
 * {@code minTrainingSize} records. Any fault while predicting is logged and
 * yields no finding for that sample.
 * </p>
 *
 * @since 1.0.0
 */
public class PredictiveDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(PredictiveDetector.class);

    private final int minTrainingSize;
    private final DetectionThresholds thresholds;
    private final SeverityPolicy severityPolicy;

    public PredictiveDetector(int minTrainingSize, DetectionThresholds thresholds) {
        this.minTrainingSize = minTrainingSize;
        this.thresholds = Objects.requireNonNull(thresholds, "DetectionThresholds must not be null");
        this.severityPolicy = new SeverityPolicy(thresholds);
    }

    @Override
    public List<Finding> evaluate(Sample sample, DetectionContext context) {
        Objects.requireNonNull(sample, "Sample must not be null");
        PowerPredictor predictor = context.predictor();

        if (!predictor.isReady() || context.history().size() < minTrainingSize) {
            LOG.trace("Predictive detection skipped: modelReady={} history={}",
                    predictor.isReady(), context.history().size());
            return List.of();
        }

        double predicted;
        try {
            predicted = predictor.predict(sample.getVoltage(), sample.getCurrent());
        } catch (ModelNotReadyException e) {
            LOG.debug("Predictive detection skipped: {}", e.getMessage());
            return List.of();
        } catch (RuntimeException e) {
            LOG.warn("Power prediction failed for device {} – skipping predictive check: {}",
                    sample.getDeviceId(), e.getMessage());
            return List.of();
        }

        double actual = sample.getPower();
        double relativeError = Math.abs(actual - predicted) / Math.max(predicted, thresholds.getPredictionFloor());
        if (!(relativeError > thresholds.getRelativeError())) {
            return List.of();
        }

        LOG.debug("Prediction deviation fired: actual={} predicted={} relativeError={}",
                actual, predicted, relativeError);
        return List.of(Finding.builder()
                .score(relativeError)
                .kind(FindingKind.POWER_PREDICTION_ANOMALY)
                .method(DetectionMethod.PREDICTIVE)
                .severity(severityPolicy.classify(DetectionMethod.PREDICTIVE, relativeError, 0))
                .message(String.format(Locale.ROOT,
                        "Power %.1fW deviates %.1f%% from predicted %.1fW",
                        actual, relativeError * 100, predicted))
                .build());
    }

    @Override
    public String getName() {
        return "predictive";
    }
}
