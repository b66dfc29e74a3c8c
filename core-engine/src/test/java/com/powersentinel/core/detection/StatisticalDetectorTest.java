package com.powersentinel.core.detection;

import com.powersentinel.core.config.DetectionThresholds;
import com.powersentinel.core.history.SlidingHistory;
import com.powersentinel.core.model.DetectionMethod;
import com.powersentinel.core.model.FeatureRecord;
import com.powersentinel.core.model.Finding;
import com.powersentinel.core.model.FindingKind;
import com.powersentinel.core.model.Sample;
import com.powersentinel.core.model.Severity;
import com.powersentinel.core.prediction.PowerPredictor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.powersentinel.core.testutil.TestTelemetry.sample;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link StatisticalDetector}.
 */
class StatisticalDetectorTest {

    private SlidingHistory history;
    private DetectionContext context;
    private StatisticalDetector detector;

    @BeforeEach
    void setUp() {
        history = new SlidingHistory();
        context = new DetectionContext(history, new PowerPredictor());
        detector = new StatisticalDetector(10, new DetectionThresholds());
    }

    @Test
    @DisplayName("Should NOT fire during warm-up")
    void shouldNotFireBelowWarmup() {
        for (int i = 0; i < 8; i++) {
            history.append(FeatureRecord.of(230, 5, 1150));
        }

        assertThat(evaluate(sample(400, 50, 20_000))).isEmpty();
    }

    @Test
    @DisplayName("Should NOT fire for a value identical to a constant history")
    void shouldNotFireOnIdenticalValues() {
        for (int i = 0; i < 15; i++) {
            history.append(FeatureRecord.of(230, 5, 1150));
        }

        assertThat(evaluate(sample(230, 5, 1150))).isEmpty();
    }

    @Test
    @DisplayName("Should fire a high power z-score for 1000 against a 100 W baseline")
    void shouldFireHighZscoreOnSpike() {
        for (int i = 0; i < 20; i++) {
            history.append(FeatureRecord.of(230, 1, 100));
        }

        List<Finding> findings = evaluate(sample(230, 1, 1000));

        Finding zscore = findings.get(0);
        assertThat(zscore.getKind()).isEqualTo(FindingKind.POWER_ANOMALY);
        assertThat(zscore.getMethod()).isEqualTo(DetectionMethod.Z_SCORE);
        assertThat(zscore.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(zscore.getScore()).isGreaterThan(3.5);
        assertThat(zscore.getMessage()).startsWith("Power 1000.0W is");
    }

    @Test
    @DisplayName("Should flag a voltage spike without touching other metrics")
    void shouldFlagVoltageOnly() {
        for (int i = 0; i < 20; i++) {
            history.append(FeatureRecord.of(100, 2, 200));
        }

        List<Finding> findings = evaluate(sample(1000, 2, 200));

        assertThat(findings).extracting(Finding::getKind).containsExactly(FindingKind.VOLTAGE_ANOMALY);
        assertThat(findings.get(0).getMessage()).contains("V is").contains("standard deviations");
    }

    @Test
    @DisplayName("Should fire a power outlier for 5000 against a 1000-2000 W spread")
    void shouldFireIqrOutlier() {
        seedUniformPower();

        List<Finding> findings = evaluate(sample(230, 5, 5_000));

        assertThat(findings).extracting(Finding::getKind)
                .containsExactly(FindingKind.POWER_ANOMALY, FindingKind.POWER_OUTLIER);
        Finding outlier = findings.get(1);
        assertThat(outlier.getMethod()).isEqualTo(DetectionMethod.IQR);
        assertThat(outlier.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(outlier.getScore()).isGreaterThan(2_000);
        assertThat(outlier.getMessage()).contains("outlier").contains("normal range");
    }

    @Test
    @DisplayName("Should NOT fire for 1500 inside a 1000-2000 W spread")
    void shouldNotFireInsideFences() {
        seedUniformPower();

        assertThat(evaluate(sample(230, 5, 1_500))).isEmpty();
    }

    @Test
    @DisplayName("Should flag a low outlier against the lower fence")
    void shouldFireLowOutlier() {
        seedUniformPower();

        List<Finding> findings = evaluate(sample(230, 5, 0));

        assertThat(findings).extracting(Finding::getKind).contains(FindingKind.POWER_OUTLIER);
    }

    @Test
    @DisplayName("Should NOT fire when the statistics overflow to NaN")
    void shouldNotFireOnNonFiniteStatistics() {
        for (int i = 0; i < 20; i++) {
            history.append(FeatureRecord.of(230, 5, 1.0e307));
        }

        assertThat(evaluate(sample(230, 5, 1.0e307))).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Power 1000..2000 W in 10 W steps; voltage and current constant. */
    private void seedUniformPower() {
        for (int p = 1_000; p <= 2_000; p += 10) {
            history.append(FeatureRecord.of(230, 5, p));
        }
    }

    /** Mirrors the engine: the sample is part of its own baseline. */
    private List<Finding> evaluate(Sample sample) {
        history.append(FeatureRecord.from(sample));
        return detector.evaluate(sample, context);
    }
}
