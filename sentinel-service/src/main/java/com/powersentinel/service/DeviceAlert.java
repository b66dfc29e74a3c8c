package com.powersentinel.service;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.powersentinel.core.model.DetectionMethod;
import com.powersentinel.core.model.Finding;
import com.powersentinel.core.model.FindingKind;
import com.powersentinel.core.model.Sample;
import com.powersentinel.core.model.Severity;

import java.time.Instant;
import java.util.Objects;

/**
 * Alert envelope handed to an {@link AlertSink}: one per {@link Finding},
 * tagged with the device and timestamp of the sample that raised it.
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #of(Sample, Finding)} from the dispatch path or the
 * {@link Builder} elsewhere. {@code deviceId}, {@code timestamp},
 * {@code type}, {@code method} and {@code severity} are required.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "deviceId", "timestamp", "type", "method", "message", "severity", "score" })
public final class DeviceAlert {

    private final String deviceId;
    private final Instant timestamp;
    private final FindingKind type;
    private final DetectionMethod method;
    private final String message;
    private final Severity severity;
    private final double score;

    private DeviceAlert(Builder builder) {
        this.deviceId = Objects.requireNonNull(builder.deviceId, "deviceId must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.method = Objects.requireNonNull(builder.method, "method must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.message = builder.message != null ? builder.message : "";
        this.score = builder.score;
    }

    public static DeviceAlert of(Sample sample, Finding finding) {
        Objects.requireNonNull(sample, "Sample must not be null");
        Objects.requireNonNull(finding, "Finding must not be null");
        return builder()
                .deviceId(sample.getDeviceId())
                .timestamp(sample.getTimestamp())
                .type(finding.getKind())
                .method(finding.getMethod())
                .message(finding.getMessage())
                .severity(finding.getSeverity())
                .score(finding.getScore())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String deviceId;
        private Instant timestamp;
        private FindingKind type;
        private DetectionMethod method;
        private String message;
        private Severity severity;
        private double score;

        public Builder deviceId(String deviceId) {
            this.deviceId = deviceId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder type(FindingKind type) {
            this.type = type;
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

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public DeviceAlert build() {
            return new DeviceAlert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getDeviceId() {
        return deviceId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public FindingKind getType() {
        return type;
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

    public double getScore() {
        return score;
    }

    @Override
    public String toString() {
        return "DeviceAlert{" +
                "deviceId='" + deviceId + '\'' +
                ", timestamp=" + timestamp +
                ", type=" + type +
                ", method=" + method +
                ", severity=" + severity +
                ", score=" + score +
                ", message='" + message + '\'' +
                '}';
    }
}
