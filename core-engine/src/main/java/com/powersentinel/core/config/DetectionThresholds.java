package com.powersentinel.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Firing and severity thresholds for every detection method.
 *
 * <p>
 * Loaded from the {@code thresholds} block of the engine YAML. Defaults match
 * the values the detectors were tuned with.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionThresholds implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Z-score above which a metric is anomalous. */
    private double zscore = 2.5;

    /** Z-score above which an anomaly is high severity. */
    private double zscoreHigh = 3.5;

    /** IQR multiplier for the outlier fences. */
    private double iqrMultiplier = 1.5;

    /** Distance beyond the fence, in IQRs, above which an outlier is high severity. */
    private double iqrHighFactor = 2.0;

    /** Relative prediction error above which a reading is anomalous. */
    private double relativeError = 0.15;

    /** Relative prediction error above which an anomaly is high severity. */
    private double relativeErrorHigh = 0.30;

    /** Lower bound of the divisor used for the relative prediction error. */
    private double predictionFloor = 1.0;

    /**
     * Append every invalid value to {@code errors}.
     *
     * @param errors collector for validation messages
     */
    void collectErrors(List<String> errors) {
        if (!(zscore > 0)) {
            errors.add("thresholds.zscore must be > 0, got: " + zscore);
        }
        if (!(zscoreHigh >= zscore)) {
            errors.add("thresholds.zscoreHigh must be >= zscore, got: " + zscoreHigh);
        }
        if (!(iqrMultiplier > 0)) {
            errors.add("thresholds.iqrMultiplier must be > 0, got: " + iqrMultiplier);
        }
        if (!(iqrHighFactor > 0)) {
            errors.add("thresholds.iqrHighFactor must be > 0, got: " + iqrHighFactor);
        }
        if (!(relativeError > 0)) {
            errors.add("thresholds.relativeError must be > 0, got: " + relativeError);
        }
        if (!(relativeErrorHigh >= relativeError)) {
            errors.add("thresholds.relativeErrorHigh must be >= relativeError, got: " + relativeErrorHigh);
        }
        if (!(predictionFloor > 0)) {
            errors.add("thresholds.predictionFloor must be > 0, got: " + predictionFloor);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getZscore() {
        return zscore;
    }

    public void setZscore(double zscore) {
        this.zscore = zscore;
    }

    public double getZscoreHigh() {
        return zscoreHigh;
    }

    public void setZscoreHigh(double zscoreHigh) {
        this.zscoreHigh = zscoreHigh;
    }

    public double getIqrMultiplier() {
        return iqrMultiplier;
    }

    public void setIqrMultiplier(double iqrMultiplier) {
        this.iqrMultiplier = iqrMultiplier;
    }

    public double getIqrHighFactor() {
        return iqrHighFactor;
    }

    public void setIqrHighFactor(double iqrHighFactor) {
        this.iqrHighFactor = iqrHighFactor;
    }

    public double getRelativeError() {
        return relativeError;
    }

    public void setRelativeError(double relativeError) {
        this.relativeError = relativeError;
    }

    public double getRelativeErrorHigh() {
        return relativeErrorHigh;
    }

    public void setRelativeErrorHigh(double relativeErrorHigh) {
        this.relativeErrorHigh = relativeErrorHigh;
    }

    public double getPredictionFloor() {
        return predictionFloor;
    }

    public void setPredictionFloor(double predictionFloor) {
        this.predictionFloor = predictionFloor;
    }

    @Override
    public String toString() {
        return "DetectionThresholds{" +
                "zscore=" + zscore +
                ", zscoreHigh=" + zscoreHigh +
                ", iqrMultiplier=" + iqrMultiplier +
                ", iqrHighFactor=" + iqrHighFactor +
                ", relativeError=" + relativeError +
                ", relativeErrorHigh=" + relativeErrorHigh +
                ", predictionFloor=" + predictionFloor +
                '}';
    }
}
