package com.powersentinel.core.detection;

import com.powersentinel.core.config.DetectionThresholds;
import com.powersentinel.core.history.Metric;
import com.powersentinel.core.history.SlidingHistory;
import com.powersentinel.core.model.DetectionMethod;
import com.powersentinel.core.model.Finding;
import com.powersentinel.core.model.FindingKind;
import com.powersentinel.core.model.Sample;
import com.powersentinel.core.model.Severity;
import com.powersentinel.core.stats.StatSummary;
import com.powersentinel.core.stats.StatSummaryCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Z-score and IQR detector over the sliding history.
 *
 * <h3>Rules</h3>
 * <ul>
 * <li>Voltage, current and power: {@code z = |value - mean| / σ}; fires when
 * {@code z} exceeds the z-score threshold. A constant history ({@code σ = 0})
 * gives {@code z = 0}.</li>
 * <li>Power only: fires when the value lies outside
 * {@code [Q1 - k·IQR, Q3 + k·IQR]}; the score is the distance to the nearest
 * fence.</li>
 * </ul>
 * <p>
 * The two power rules are independent and can both fire for one sample.
 * Findings are emitted in the order voltage, current, power z-score, power
 * outlier.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * Nothing fires until the history holds at least {@code warmupSize} records.
 * The baseline is the history as handed over by the engine, which already
 * contains the sample under evaluation.
 * </p>
 *
 * @since 1.0.0
 */
public class StatisticalDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(StatisticalDetector.class);

    private final int warmupSize;
    private final DetectionThresholds thresholds;
    private final SeverityPolicy severityPolicy;

    /**
     * @param warmupSize minimum history size; must be &gt;=
     *                   {@value StatSummaryCalculator#MIN_SAMPLE_SIZE}
     * @param thresholds firing and severity thresholds
     */
    public StatisticalDetector(int warmupSize, DetectionThresholds thresholds) {
        if (warmupSize < StatSummaryCalculator.MIN_SAMPLE_SIZE) {
            throw new IllegalArgumentException("warmupSize must be >= "
                    + StatSummaryCalculator.MIN_SAMPLE_SIZE + ", got: " + warmupSize);
        }
        this.warmupSize = warmupSize;
        this.thresholds = Objects.requireNonNull(thresholds, "DetectionThresholds must not be null");
        this.severityPolicy = new SeverityPolicy(thresholds);
    }

    @Override
    public List<Finding> evaluate(Sample sample, DetectionContext context) {
        Objects.requireNonNull(sample, "Sample must not be null");
        SlidingHistory history = context.history();

        if (history.size() < warmupSize) {
            LOG.trace("Statistical detection skipped: history {} < warm-up {}", history.size(), warmupSize);
            return List.of();
        }

        List<Finding> findings = new ArrayList<>(4);
        zscoreFinding(Metric.VOLTAGE, FindingKind.VOLTAGE_ANOMALY, sample.getVoltage(), history)
                .ifPresent(findings::add);
        zscoreFinding(Metric.CURRENT, FindingKind.CURRENT_ANOMALY, sample.getCurrent(), history)
                .ifPresent(findings::add);

        StatSummary power = StatSummaryCalculator.summarize(history.projection(Metric.POWER));
        zscoreFinding(Metric.POWER, FindingKind.POWER_ANOMALY, sample.getPower(), power)
                .ifPresent(findings::add);
        outlierFinding(sample.getPower(), power).ifPresent(findings::add);

        return findings;
    }

    @Override
    public String getName() {
        return "statistical";
    }

    // ---------------------------------------------------------------
    // Rules
    // ---------------------------------------------------------------

    private Optional<Finding> zscoreFinding(Metric metric, FindingKind kind, double value, SlidingHistory history) {
        return zscoreFinding(metric, kind, value, StatSummaryCalculator.summarize(history.projection(metric)));
    }

    private Optional<Finding> zscoreFinding(Metric metric, FindingKind kind, double value, StatSummary stats) {
        double z = stats.zScore(value);
        // NaN statistics never fire
        if (!(z > thresholds.getZscore())) {
            return Optional.empty();
        }
        Severity severity = severityPolicy.classify(DetectionMethod.Z_SCORE, z, 0);
        LOG.debug("{} z-score fired: value={} mean={} stddev={} z={}",
                metric.getDisplayName(), value, stats.getMean(), stats.getStdDev(), z);

        String unit = metric.getUnit();
        return Optional.of(Finding.builder()
                .score(z)
                .kind(kind)
                .method(DetectionMethod.Z_SCORE)
                .severity(severity)
                .message(String.format(Locale.ROOT,
                        "%s %.1f%s is %.1f standard deviations from normal (%.1f±%.1f%s)",
                        metric.getDisplayName(), value, unit, z, stats.getMean(), stats.getStdDev(), unit))
                .build());
    }

    private Optional<Finding> outlierFinding(double power, StatSummary stats) {
        double iqr = stats.getIqr();
        double lowerBound = stats.getQ1() - thresholds.getIqrMultiplier() * iqr;
        double upperBound = stats.getQ3() + thresholds.getIqrMultiplier() * iqr;

        if (!(power < lowerBound || power > upperBound)) {
            return Optional.empty();
        }
        double distance = Math.min(Math.abs(power - lowerBound), Math.abs(power - upperBound));
        Severity severity = severityPolicy.classify(DetectionMethod.IQR, distance, iqr);
        LOG.debug("Power outlier fired: value={} fences=[{}, {}] distance={}",
                power, lowerBound, upperBound, distance);

        return Optional.of(Finding.builder()
                .score(distance)
                .kind(FindingKind.POWER_OUTLIER)
                .method(DetectionMethod.IQR)
                .severity(severity)
                .message(String.format(Locale.ROOT,
                        "Power %.1fW is an outlier (normal range: %.1f-%.1fW)",
                        power, lowerBound, upperBound))
                .build());
    }
}
