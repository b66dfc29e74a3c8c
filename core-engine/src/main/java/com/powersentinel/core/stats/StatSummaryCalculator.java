package com.powersentinel.core.stats;

import org.apache.commons.math3.stat.StatUtils;

import java.util.Arrays;
import java.util.Objects;

/**
 * Computes a {@link StatSummary} from a numeric sample.
 *
 * <p>
 * Mean and standard deviation use the <strong>population</strong> variance.
 * Quartiles use nearest rank on the value-sorted sample without
 * interpolation: {@code Q1 = sorted[floor(n × 0.25)]},
 * {@code Q3 = sorted[floor(n × 0.75)]}.
 * </p>
 *
 * @since 1.0.0
 */
public final class StatSummaryCalculator {

    /** Smallest sample for which the summary is defined. */
    public static final int MIN_SAMPLE_SIZE = 2;

    private StatSummaryCalculator() {
        // utility class — not instantiable
    }

    /**
     * @param values the sample, in any order; must not be {@code null}
     * @return the summary
     * @throws NullPointerException     if {@code values} is {@code null}
     * @throws IllegalArgumentException if fewer than {@value #MIN_SAMPLE_SIZE}
     *                                  values are supplied
     */
    public static StatSummary summarize(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        int n = values.length;
        if (n < MIN_SAMPLE_SIZE) {
            throw new IllegalArgumentException(
                    "Insufficient data: at least " + MIN_SAMPLE_SIZE + " values required, got: " + n);
        }

        double[] sorted = Arrays.copyOf(values, n);
        Arrays.sort(sorted);

        double mean = StatUtils.mean(sorted);
        double stdDev = Math.sqrt(StatUtils.populationVariance(sorted, mean));

        return new StatSummary(
                n,
                mean,
                stdDev,
                sorted[0],
                sorted[n - 1],
                sorted[(int) (n * 0.25)],
                sorted[(int) (n * 0.75)]);
    }
}
