package com.powersentinel.core.prediction;

/**
 * Thrown when a model fit fails on bad data or a numerical problem.
 *
 * @since 1.0.0
 */
public class ModelTrainingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ModelTrainingException(String message) {
        super(message);
    }

    public ModelTrainingException(String message, Throwable cause) {
        super(message, cause);
    }
}
