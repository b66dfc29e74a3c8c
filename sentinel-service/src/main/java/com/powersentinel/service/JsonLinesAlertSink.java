package com.powersentinel.service;

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * {@link AlertSink} that writes one JSON alert per line.
 */
public class JsonLinesAlertSink implements AlertSink {

    private final PrintWriter out;
    private final AlertEncoder encoder;

    public JsonLinesAlertSink(OutputStream out) {
        this(out, new AlertEncoder());
    }

    public JsonLinesAlertSink(OutputStream out, AlertEncoder encoder) {
        Objects.requireNonNull(out, "OutputStream must not be null");
        this.out = new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8), false);
        this.encoder = Objects.requireNonNull(encoder, "AlertEncoder must not be null");
    }

    @Override
    public synchronized void publish(DeviceAlert alert) {
        Objects.requireNonNull(alert, "DeviceAlert must not be null");
        out.println(encoder.encode(alert));
        out.flush();
        if (out.checkError()) {
            throw new IllegalStateException("Failed to write alert for device " + alert.getDeviceId());
        }
    }
}
