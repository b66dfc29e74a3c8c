package com.powersentinel.core.prediction;

import java.time.Instant;

/**
 * A live model together with the facts of its fit. Immutable.
 */
final class TrainedModel {

    private final RegressionModel model;
    private final Instant trainedAt;
    private final int trainingSize;

    TrainedModel(RegressionModel model, Instant trainedAt, int trainingSize) {
        this.model = model;
        this.trainedAt = trainedAt;
        this.trainingSize = trainingSize;
    }

    RegressionModel model() {
        return model;
    }

    Instant trainedAt() {
        return trainedAt;
    }

    int trainingSize() {
        return trainingSize;
    }
}
