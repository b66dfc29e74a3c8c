package com.powersentinel.service;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.powersentinel.core.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts raw telemetry JSON into a {@link Sample}.
 *
 * <p>
 * Accepts {@code deviceId} (or the legacy {@code deviceIdentifier}), an
 * optional ISO-8601 {@code timestamp} and the numeric {@code voltage},
 * {@code current} and {@code power} readings. Property names are matched
 * case-insensitively; unknown fields such as cumulative {@code energy} are
 * ignored.
 * </p>
 *
 * <p>
 * Malformed payloads are logged and dropped (returns {@link Optional#empty()}),
 * so a single bad message never reaches the engine.
 * </p>
 *
 * @since 1.0.0
 */
public class SampleDecoder {

    private static final Logger LOG = LoggerFactory.getLogger(SampleDecoder.class);

    private final ObjectMapper mapper;
    private final Clock clock;

    public SampleDecoder() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock supplies the ingestion time for payloads without a timestamp
     */
    public SampleDecoder(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES, true)
                .build();
    }

    /**
     * @param message raw JSON bytes; {@code null} or empty yields empty
     * @return the decoded sample, or empty if the payload is unusable
     */
    public Optional<Sample> decode(byte[] message) {
        if (message == null || message.length == 0) {
            return Optional.empty();
        }
        try {
            TelemetryPayload payload = mapper.readValue(message, TelemetryPayload.class);
            return Optional.of(toSample(payload));
        } catch (IOException | IllegalArgumentException e) {
            LOG.warn("Failed to decode telemetry – skipping: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Sample toSample(TelemetryPayload payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload is null");
        }
        if (payload.deviceId == null || payload.deviceId.isBlank()) {
            throw new IllegalArgumentException("deviceId is required");
        }
        Instant timestamp = payload.timestamp != null ? payload.timestamp : clock.instant();
        return new Sample(payload.deviceId, timestamp,
                require(payload.voltage, "voltage"),
                require(payload.current, "current"),
                require(payload.power, "power"));
    }

    private static double require(Double value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    /** Wire shape of an incoming telemetry message. */
    static final class TelemetryPayload {
        @JsonAlias("deviceIdentifier")
        public String deviceId;
        public Instant timestamp;
        public Double voltage;
        public Double current;
        public Double power;
    }
}
