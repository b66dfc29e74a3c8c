package com.powersentinel.core.prediction;

import com.powersentinel.core.model.FeatureRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Predicts power draw from voltage and current with a trainable regression
 * model over {@code {voltage, current, powerFactor, efficiency}}.
 *
 * <h3>Model lifecycle</h3>
 * <p>
 * The predictor starts without a model. Each successful {@link #fit} builds a
 * new model completely before publishing it, together with its training
 * instant, through a single reference swap. Concurrent {@link #predict} calls
 * therefore see either the previous model or the new one, never a partially
 * built one. A failed fit leaves the previous model (or its absence) live.
 * </p>
 *
 * @since 1.0.0
 */
public class PowerPredictor {

    private static final Logger LOG = LoggerFactory.getLogger(PowerPredictor.class);

    /** Default minimum number of records required to fit. */
    public static final int DEFAULT_MIN_TRAINING_SIZE = 50;

    /** Number of model inputs. */
    public static final int FEATURE_COUNT = 4;

    private final RegressionTrainer trainer;
    private final int minTrainingSize;
    private final AtomicReference<TrainedModel> live = new AtomicReference<>();

    public PowerPredictor() {
        this(new QuadraticRidgeRegression(), DEFAULT_MIN_TRAINING_SIZE);
    }

    /**
     * @param trainer         builds the regression model; must not be
     *                        {@code null}
     * @param minTrainingSize minimum records per fit; must be &gt;= 2
     */
    public PowerPredictor(RegressionTrainer trainer, int minTrainingSize) {
        this.trainer = Objects.requireNonNull(trainer, "RegressionTrainer must not be null");
        if (minTrainingSize < 2) {
            throw new IllegalArgumentException("minTrainingSize must be >= 2, got: " + minTrainingSize);
        }
        this.minTrainingSize = minTrainingSize;
    }

    /**
     * Fit a new model and make it live.
     *
     * @param records   training records; at least {@link #getMinTrainingSize()}
     * @param trainedAt instant recorded as the training time
     * @throws IllegalArgumentException if too few records are supplied
     * @throws ModelTrainingException   if the fit fails; the previous model
     *                                  stays live
     */
    public void fit(List<FeatureRecord> records, Instant trainedAt) {
        Objects.requireNonNull(records, "records must not be null");
        Objects.requireNonNull(trainedAt, "trainedAt must not be null");
        if (records.size() < minTrainingSize) {
            throw new IllegalArgumentException("Insufficient data: at least " + minTrainingSize
                    + " records required to fit, got: " + records.size());
        }

        int n = records.size();
        double[][] features = new double[n][];
        double[] targets = new double[n];
        for (int i = 0; i < n; i++) {
            FeatureRecord record = records.get(i);
            features[i] = trainingFeatures(record);
            targets[i] = record.getPower();
        }

        RegressionModel model;
        try {
            model = trainer.fit(features, targets);
        } catch (ModelTrainingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ModelTrainingException("Regression fit failed: " + e.getMessage(), e);
        }
        if (model == null) {
            throw new ModelTrainingException("Regression trainer returned no model");
        }

        live.set(new TrainedModel(model, trainedAt, n));
        LOG.info("Power model trained on {} record(s) at {}", n, trainedAt);
    }

    /**
     * Predict power draw for a voltage/current pair.
     *
     * @param voltage volts
     * @param current amperes
     * @return predicted watts
     * @throws ModelNotReadyException if no model has been fitted yet
     * @throws ArithmeticException    if the model yields a non-finite value
     */
    public double predict(double voltage, double current) {
        TrainedModel trained = live.get();
        if (trained == null) {
            throw new ModelNotReadyException("Power model has not been trained yet");
        }
        double predicted = trained.model().predict(queryFeatures(voltage, current));
        if (!Double.isFinite(predicted)) {
            throw new ArithmeticException("Power model produced a non-finite prediction: " + predicted);
        }
        return predicted;
    }

    public boolean isReady() {
        return live.get() != null;
    }

    /**
     * @return instant of the last successful fit, empty if never trained
     */
    public Optional<Instant> lastTrained() {
        TrainedModel trained = live.get();
        return trained == null ? Optional.empty() : Optional.of(trained.trainedAt());
    }

    /**
     * @return number of records the live model was fitted on, {@code 0} if
     *         never trained
     */
    public int trainingSize() {
        TrainedModel trained = live.get();
        return trained == null ? 0 : trained.trainingSize();
    }

    public int getMinTrainingSize() {
        return minTrainingSize;
    }

    // ---------------------------------------------------------------
    // Feature vectors
    // ---------------------------------------------------------------

    static double[] trainingFeatures(FeatureRecord record) {
        return new double[] {
                record.getVoltage(),
                record.getCurrent(),
                record.getPowerFactor(),
                record.getEfficiency()
        };
    }

    /**
     * Features of a query point. Real power is what is being predicted, so the
     * power factor comes from apparent power alone: unity for loads of at least
     * 1 VA, proportionally less below that, and zero without current.
     */
    static double[] queryFeatures(double voltage, double current) {
        double apparent = voltage * current;
        double powerFactor = current > 0 ? apparent / Math.max(apparent, 1) : 0;
        return new double[] { voltage, current, powerFactor, powerFactor * 100.0 };
    }
}
