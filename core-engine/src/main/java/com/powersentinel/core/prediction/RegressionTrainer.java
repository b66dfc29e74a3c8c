package com.powersentinel.core.prediction;

/**
 * Builds a {@link RegressionModel} from a training set.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface RegressionTrainer {

    /**
     * Fit a new model. The returned instance must be fully built and
     * independent of any previously returned model.
     *
     * @param features one row per observation, all rows of equal length
     * @param targets  target value per observation
     * @return the fitted model
     * @throws ModelTrainingException if the data cannot be fitted
     */
    RegressionModel fit(double[][] features, double[] targets);
}
