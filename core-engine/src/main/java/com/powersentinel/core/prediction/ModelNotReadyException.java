package com.powersentinel.core.prediction;

/**
 * Thrown when a prediction is requested before any model has been fitted.
 *
 * <p>
 * Callers treat this as "skip predictive detection", never as a fatal error.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelNotReadyException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public ModelNotReadyException(String message) {
        super(message);
    }
}
