package com.powersentinel.core.prediction;

import com.powersentinel.core.model.FeatureRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.powersentinel.core.testutil.TestTelemetry.EPOCH;
import static com.powersentinel.core.testutil.TestTelemetry.resistiveRecords;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link PowerPredictor}.
 */
class PowerPredictorTest {

    @Test
    @DisplayName("Should report not ready before the first fit")
    void shouldNotBeReadyBeforeFit() {
        PowerPredictor predictor = new PowerPredictor();

        assertThat(predictor.isReady()).isFalse();
        assertThat(predictor.lastTrained()).isEmpty();
        assertThatThrownBy(() -> predictor.predict(230, 5))
                .isInstanceOf(ModelNotReadyException.class);
    }

    @Test
    @DisplayName("Should refuse to fit below the minimum training size")
    void shouldRejectTooFewRecords() {
        PowerPredictor predictor = new PowerPredictor();

        assertThatThrownBy(() -> predictor.fit(resistiveRecords(49), EPOCH))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Insufficient data");
        assertThat(predictor.isReady()).isFalse();
    }

    @Test
    @DisplayName("Should learn power = V × I and predict ~1150 W at 230 V / 5 A")
    void shouldPredictResistiveLoad() {
        PowerPredictor predictor = new PowerPredictor();

        predictor.fit(resistiveRecords(100), EPOCH);

        assertThat(predictor.isReady()).isTrue();
        assertThat(predictor.lastTrained()).contains(EPOCH);
        assertThat(predictor.trainingSize()).isEqualTo(100);
        assertThat(predictor.predict(230, 5)).isCloseTo(1150.0, within(1.0));
    }

    @Test
    @DisplayName("Should keep the previous model when a refit fails")
    void shouldKeepModelOnFailedRefit() {
        boolean[] fail = { false };
        QuadraticRidgeRegression delegate = new QuadraticRidgeRegression();
        PowerPredictor predictor = new PowerPredictor((x, y) -> {
            if (fail[0]) {
                throw new IllegalStateException("solver exploded");
            }
            return delegate.fit(x, y);
        }, 50);
        predictor.fit(resistiveRecords(60), EPOCH);

        fail[0] = true;
        Instant later = EPOCH.plusSeconds(3600);
        assertThatThrownBy(() -> predictor.fit(resistiveRecords(60), later))
                .isInstanceOf(ModelTrainingException.class)
                .hasMessageContaining("solver exploded");

        assertThat(predictor.lastTrained()).contains(EPOCH);
        assertThat(predictor.predict(230, 5)).isCloseTo(1150.0, within(1.0));
    }

    @Test
    @DisplayName("Query features treat the load as purely resistive")
    void queryFeaturesAssumeUnitPowerFactor() {
        assertThat(PowerPredictor.queryFeatures(230, 5)).containsExactly(230, 5, 1.0, 100.0);
        assertThat(PowerPredictor.queryFeatures(230, 0)).containsExactly(230, 0, 0.0, 0.0);
    }

    @Test
    @DisplayName("Training features come straight from the record")
    void trainingFeaturesMirrorRecord() {
        double[] features = PowerPredictor.trainingFeatures(FeatureRecord.of(200, 2, 200));

        assertThat(features).containsExactly(200, 2, 0.5, 50.0);
        assertThat(features).hasSize(PowerPredictor.FEATURE_COUNT);
    }

    @Test
    @DisplayName("Should reject a minimum training size below two")
    void shouldRejectTinyMinimum() {
        assertThatThrownBy(() -> new PowerPredictor(new QuadraticRidgeRegression(), 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PowerPredictor().fit(List.of(), null))
                .isInstanceOf(NullPointerException.class);
    }
}
