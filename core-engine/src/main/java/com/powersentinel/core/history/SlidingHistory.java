package com.powersentinel.core.history;

import com.powersentinel.core.model.FeatureRecord;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Bounded, insertion-ordered buffer of {@link FeatureRecord}s.
 *
 * <p>
 * Appends go to the back; once the capacity is exceeded the oldest record is
 * evicted from the front. There is no other removal.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. The owning engine performs
 * every append and projection inside its own critical section.
 * </p>
 *
 * @since 1.0.0
 */
public class SlidingHistory {

    /** Default number of records retained. */
    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final Deque<FeatureRecord> records = new ArrayDeque<>();

    public SlidingHistory() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param capacity maximum number of retained records; must be &gt; 0
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public SlidingHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Append a record, evicting the oldest one if the capacity is exceeded.
     *
     * @param record the record to add; must not be {@code null}
     */
    public void append(FeatureRecord record) {
        Objects.requireNonNull(record, "FeatureRecord must not be null");
        records.addLast(record);
        while (records.size() > capacity) {
            records.pollFirst();
        }
    }

    public int size() {
        return records.size();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Extract one metric from every record, oldest first.
     *
     * @param metric the column to project; must not be {@code null}
     * @return a fresh array of {@link #size()} values
     */
    public double[] projection(Metric metric) {
        Objects.requireNonNull(metric, "Metric must not be null");
        double[] values = new double[records.size()];
        int i = 0;
        for (FeatureRecord record : records) {
            values[i++] = metric.valueOf(record);
        }
        return values;
    }

    /**
     * @return an immutable copy of the current records, oldest first
     */
    public List<FeatureRecord> snapshot() {
        return List.copyOf(records);
    }
}
