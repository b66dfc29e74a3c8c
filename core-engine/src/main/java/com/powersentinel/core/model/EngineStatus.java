package com.powersentinel.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Point-in-time diagnostic view of an anomaly engine.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "historySize", "modelTrained", "lastTrained" })
public final class EngineStatus implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int historySize;
    private final boolean modelTrained;
    private final Instant lastTrained;

    /**
     * @param historySize  number of records currently held
     * @param modelTrained whether a prediction model is live
     * @param lastTrained  instant of the last successful fit, or {@code null}
     *                     if never trained
     */
    public EngineStatus(int historySize, boolean modelTrained, Instant lastTrained) {
        this.historySize = historySize;
        this.modelTrained = modelTrained;
        this.lastTrained = lastTrained;
    }

    public int getHistorySize() {
        return historySize;
    }

    public boolean isModelTrained() {
        return modelTrained;
    }

    /**
     * @return instant of the last successful fit, or {@code null} if never
     *         trained
     */
    public Instant getLastTrained() {
        return lastTrained;
    }

    public Optional<Instant> lastTrained() {
        return Optional.ofNullable(lastTrained);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EngineStatus that))
            return false;
        return historySize == that.historySize
                && modelTrained == that.modelTrained
                && Objects.equals(lastTrained, that.lastTrained);
    }

    @Override
    public int hashCode() {
        return Objects.hash(historySize, modelTrained, lastTrained);
    }

    @Override
    public String toString() {
        return "EngineStatus{" +
                "historySize=" + historySize +
                ", modelTrained=" + modelTrained +
                ", lastTrained=" + lastTrained +
                '}';
    }
}
