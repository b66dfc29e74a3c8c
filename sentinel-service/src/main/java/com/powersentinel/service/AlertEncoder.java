package com.powersentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Converts {@link DeviceAlert} into its JSON wire form. Timestamps are
 * written as ISO-8601 strings; enums use their display labels.
 *
 * @since 1.0.0
 */
public class AlertEncoder {

    private final ObjectMapper mapper;

    public AlertEncoder() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * @param alert alert to encode
     * @return single-line JSON document
     * @throws IllegalStateException if the alert cannot be serialised
     */
    public String encode(DeviceAlert alert) {
        try {
            return mapper.writeValueAsString(alert);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize alert: " + e.getOriginalMessage(), e);
        }
    }
}
