package com.powersentinel.core.prediction;

/**
 * A fitted regression function over a fixed-length feature vector.
 *
 * <p>
 * Implementations must be immutable once built so that a model can be
 * published to concurrent readers by a single reference swap.
 * </p>
 *
 * @since 1.0.0
 */
public interface RegressionModel {

    /**
     * @param features feature vector of length {@link #featureCount()}
     * @return the predicted target value
     */
    double predict(double[] features);

    /**
     * @return number of input features this model expects
     */
    int featureCount();
}
