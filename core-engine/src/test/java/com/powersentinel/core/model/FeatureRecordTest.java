package com.powersentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link FeatureRecord} and {@link Sample}.
 */
class FeatureRecordTest {

    @Test
    @DisplayName("Should derive power factor and efficiency from the readings")
    void shouldDeriveFeatures() {
        FeatureRecord record = FeatureRecord.from(new Sample("m", Instant.EPOCH, 230, 5, 1035));

        assertThat(record.getPowerFactor()).isCloseTo(0.9, within(1e-9));
        assertThat(record.getEfficiency()).isCloseTo(90.0, within(1e-9));
    }

    @Test
    @DisplayName("Should treat zero apparent power as a degenerate sample")
    void shouldHandleZeroApparentPower() {
        FeatureRecord noCurrent = FeatureRecord.of(230, 0, 15);
        FeatureRecord noVoltage = FeatureRecord.of(0, 4, 0);

        assertThat(noCurrent.getPowerFactor()).isZero();
        assertThat(noCurrent.getEfficiency()).isZero();
        assertThat(noVoltage.getPowerFactor()).isZero();
    }

    @Test
    @DisplayName("Should treat a vanishing apparent power as degenerate")
    void shouldKeepFeaturesFiniteForTinyApparentPower() {
        FeatureRecord record = FeatureRecord.of(1e-160, 1e-160, 1);

        assertThat(record.getPowerFactor()).isZero();
        assertThat(record.getEfficiency()).isZero();
        assertThat(FeatureRecord.powerFactor(-1, 1e-160, 1e-160)).isZero();
    }

    @Test
    @DisplayName("Should reject non-finite readings")
    void shouldRejectNonFiniteReadings() {
        assertThatThrownBy(() -> new Sample("m", Instant.EPOCH, Double.NaN, 1, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("voltage");
        assertThatThrownBy(() -> new Sample("m", Instant.EPOCH, 230, 1, Double.POSITIVE_INFINITY))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("power");
    }

    @Test
    @DisplayName("Should require a device id and timestamp")
    void shouldRequireIdentity() {
        assertThatThrownBy(() -> new Sample(null, Instant.EPOCH, 1, 1, 1))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new Sample("m", null, 1, 1, 1))
                .isInstanceOf(NullPointerException.class);
    }
}
