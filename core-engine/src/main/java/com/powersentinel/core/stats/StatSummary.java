package com.powersentinel.core.stats;

import java.util.Objects;

/**
 * Descriptive statistics of one metric over a history snapshot.
 *
 * <p>
 * Valid only for the snapshot it was computed from; never cached.
 * </p>
 *
 * @see StatSummaryCalculator
 * @since 1.0.0
 */
public final class StatSummary {

    private final int count;
    private final double mean;
    private final double stdDev;
    private final double min;
    private final double max;
    private final double q1;
    private final double q3;

    StatSummary(int count, double mean, double stdDev, double min, double max, double q1, double q3) {
        this.count = count;
        this.mean = mean;
        this.stdDev = stdDev;
        this.min = min;
        this.max = max;
        this.q1 = q1;
        this.q3 = q3;
    }

    public int getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    /** Population standard deviation. */
    public double getStdDev() {
        return stdDev;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getQ1() {
        return q1;
    }

    public double getQ3() {
        return q3;
    }

    /**
     * @return interquartile range {@code Q3 - Q1}
     */
    public double getIqr() {
        return q3 - q1;
    }

    /**
     * Absolute distance of {@code value} from the mean in standard deviations.
     * A degenerate distribution ({@code stdDev == 0}) yields {@code 0}.
     *
     * @param value the observed value
     * @return non-negative z-score
     */
    public double zScore(double value) {
        if (stdDev == 0) {
            return 0;
        }
        return Math.abs(value - mean) / stdDev;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StatSummary that))
            return false;
        return count == that.count
                && Double.compare(mean, that.mean) == 0
                && Double.compare(stdDev, that.stdDev) == 0
                && Double.compare(min, that.min) == 0
                && Double.compare(max, that.max) == 0
                && Double.compare(q1, that.q1) == 0
                && Double.compare(q3, that.q3) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, mean, stdDev, min, max, q1, q3);
    }

    @Override
    public String toString() {
        return "StatSummary{" +
                "count=" + count +
                ", mean=" + mean +
                ", stdDev=" + stdDev +
                ", min=" + min +
                ", max=" + max +
                ", q1=" + q1 +
                ", q3=" + q3 +
                '}';
    }
}
