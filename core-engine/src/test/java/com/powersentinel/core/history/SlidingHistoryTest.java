package com.powersentinel.core.history;

import com.powersentinel.core.model.FeatureRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SlidingHistory}.
 */
class SlidingHistoryTest {

    @Test
    @DisplayName("Should never exceed capacity and evict the oldest records first")
    void shouldEvictFifo() {
        SlidingHistory history = new SlidingHistory(5);

        for (int i = 1; i <= 12; i++) {
            history.append(FeatureRecord.of(i, 1, i));
            assertThat(history.size()).isLessThanOrEqualTo(5);
        }

        assertThat(history.size()).isEqualTo(5);
        assertThat(history.projection(Metric.VOLTAGE)).containsExactly(8, 9, 10, 11, 12);
    }

    @Test
    @DisplayName("Should project each metric in insertion order")
    void shouldProjectMetrics() {
        SlidingHistory history = new SlidingHistory();
        history.append(FeatureRecord.of(230, 2, 460));
        history.append(FeatureRecord.of(220, 4, 440));

        assertThat(history.projection(Metric.CURRENT)).containsExactly(2, 4);
        assertThat(history.projection(Metric.POWER)).containsExactly(460, 440);
        assertThat(history.projection(Metric.POWER_FACTOR)).containsExactly(1.0, 0.5);
        assertThat(history.projection(Metric.EFFICIENCY)).containsExactly(100.0, 50.0);
    }

    @Test
    @DisplayName("Snapshot should be detached from later appends")
    void snapshotShouldBeDetached() {
        SlidingHistory history = new SlidingHistory(3);
        history.append(FeatureRecord.of(1, 1, 1));
        List<FeatureRecord> snapshot = history.snapshot();

        history.append(FeatureRecord.of(2, 1, 2));

        assertThat(snapshot).hasSize(1);
        assertThatThrownBy(() -> snapshot.add(FeatureRecord.of(3, 1, 3)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void shouldRejectInvalidCapacity() {
        assertThatThrownBy(() -> new SlidingHistory(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("capacity");
    }
}
