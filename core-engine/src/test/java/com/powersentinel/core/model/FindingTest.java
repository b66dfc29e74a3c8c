package com.powersentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Finding} and its classification enums.
 */
class FindingTest {

    @Test
    @DisplayName("Finding should always report an anomaly")
    void findingIsAlwaysAnomaly() {
        Finding finding = Finding.builder()
                .kind(FindingKind.POWER_OUTLIER)
                .method(DetectionMethod.IQR)
                .severity(Severity.MEDIUM)
                .score(12.5)
                .build();

        assertThat(finding.isAnomaly()).isTrue();
        assertThat(finding.getScore()).isEqualTo(12.5);
        assertThat(finding.getMessage()).isEmpty();
    }

    @Test
    @DisplayName("Enums should expose their display labels")
    void labels() {
        assertThat(Severity.HIGH.label()).isEqualTo("high");
        assertThat(DetectionMethod.Z_SCORE.label()).isEqualTo("Z-Score");
        assertThat(FindingKind.POWER_PREDICTION_ANOMALY.label()).isEqualTo("Power Prediction Anomaly");
    }

    @Test
    @DisplayName("Finding builder should require kind, method and severity")
    void findingRequiresClassification() {
        assertThatThrownBy(() -> Finding.builder().kind(FindingKind.POWER_ANOMALY).build())
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Finding.builder()
                .kind(FindingKind.POWER_ANOMALY)
                .method(DetectionMethod.Z_SCORE)
                .build())
                .isInstanceOf(NullPointerException.class);
    }
}
