package com.powersentinel.core.detection;

import com.powersentinel.core.config.DetectionThresholds;
import com.powersentinel.core.model.DetectionMethod;
import com.powersentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SeverityPolicy}.
 */
class SeverityPolicyTest {

    private final SeverityPolicy policy = new SeverityPolicy(new DetectionThresholds());

    @Test
    @DisplayName("Z-score tiers: > 3.5 high, > 2.5 medium")
    void zscoreTiers() {
        assertThat(policy.forZscore(2.5)).isEqualTo(Severity.LOW);
        assertThat(policy.forZscore(2.51)).isEqualTo(Severity.MEDIUM);
        assertThat(policy.forZscore(3.5)).isEqualTo(Severity.MEDIUM);
        assertThat(policy.forZscore(3.51)).isEqualTo(Severity.HIGH);
    }

    @Test
    @DisplayName("IQR tiers: beyond two IQRs is high")
    void fenceDistanceTiers() {
        assertThat(policy.forFenceDistance(0, 100)).isEqualTo(Severity.LOW);
        assertThat(policy.forFenceDistance(150, 100)).isEqualTo(Severity.MEDIUM);
        assertThat(policy.forFenceDistance(200, 100)).isEqualTo(Severity.MEDIUM);
        assertThat(policy.forFenceDistance(201, 100)).isEqualTo(Severity.HIGH);
        assertThat(policy.forFenceDistance(1, 0)).isEqualTo(Severity.HIGH);
    }

    @Test
    @DisplayName("Relative error tiers: > 0.30 high, > 0.15 medium")
    void relativeErrorTiers() {
        assertThat(policy.forRelativeError(0.15)).isEqualTo(Severity.LOW);
        assertThat(policy.forRelativeError(0.2)).isEqualTo(Severity.MEDIUM);
        assertThat(policy.forRelativeError(0.31)).isEqualTo(Severity.HIGH);
    }

    @Test
    @DisplayName("Should dispatch on detection method")
    void shouldClassifyByMethod() {
        assertThat(policy.classify(DetectionMethod.Z_SCORE, 4.0, 0)).isEqualTo(Severity.HIGH);
        assertThat(policy.classify(DetectionMethod.IQR, 50, 100)).isEqualTo(Severity.MEDIUM);
        assertThat(policy.classify(DetectionMethod.PREDICTIVE, 0.2, 0)).isEqualTo(Severity.MEDIUM);
    }

    @Test
    @DisplayName("Should follow tuned thresholds")
    void shouldHonourCustomThresholds() {
        DetectionThresholds strict = new DetectionThresholds();
        strict.setZscore(1.0);
        strict.setZscoreHigh(2.0);

        SeverityPolicy strictPolicy = new SeverityPolicy(strict);

        assertThat(strictPolicy.forZscore(1.5)).isEqualTo(Severity.MEDIUM);
        assertThat(strictPolicy.forZscore(2.5)).isEqualTo(Severity.HIGH);
    }
}
