package com.powersentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * One abnormal-reading verdict produced by a detector.
 *
 * <p>
 * Findings are transient values: the engine hands them to its caller and
 * keeps no reference. {@link #isAnomaly()} is always {@code true}; a reading
 * that is not anomalous simply produces no finding.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code kind}, {@code method} and {@code severity}
 * are required; omitting any of them throws {@link NullPointerException} at
 * build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class Finding implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double score;
    private final FindingKind kind;
    private final DetectionMethod method;
    private final String message;
    private final Severity severity;

    private Finding(Builder builder) {
        this.score = builder.score;
        this.kind = Objects.requireNonNull(builder.kind, "kind must not be null");
        this.method = Objects.requireNonNull(builder.method, "method must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.message = builder.message != null ? builder.message : "";
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Finding} instances.
     */
    public static class Builder {
        private double score;
        private FindingKind kind;
        private DetectionMethod method;
        private String message;
        private Severity severity;

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder kind(FindingKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder method(DetectionMethod method) {
            this.method = method;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        /**
         * @return a new {@link Finding}
         * @throws NullPointerException if {@code kind}, {@code method} or
         *                              {@code severity} is missing
         */
        public Finding build() {
            return new Finding(this);
        }
    }

    public boolean isAnomaly() {
        return true;
    }

    public double getScore() {
        return score;
    }

    public FindingKind getKind() {
        return kind;
    }

    public DetectionMethod getMethod() {
        return method;
    }

    public String getMessage() {
        return message;
    }

    public Severity getSeverity() {
        return severity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Finding that))
            return false;
        return Double.compare(score, that.score) == 0
                && kind == that.kind
                && method == that.method
                && severity == that.severity
                && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(score, kind, method, severity, message);
    }

    @Override
    public String toString() {
        return "Finding{" +
                "kind=" + kind +
                ", method=" + method +
                ", severity=" + severity +
                ", score=" + score +
                ", message='" + message + '\'' +
                '}';
    }
}
