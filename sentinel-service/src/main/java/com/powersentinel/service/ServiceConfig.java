package com.powersentinel.service;

import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable configuration for the Power Sentinel service host.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults so
 * the service can be configured from a container manifest or a shell.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    private final int healthPort;
    private final String engineConfigPath;
    private final int statusLogInterval;

    private ServiceConfig(Builder b) {
        this.healthPort = b.healthPort;
        this.engineConfigPath = b.engineConfigPath;
        this.statusLogInterval = b.statusLogInterval;
    }

    // ---------------------------------------------------------------
    // Factory — resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static ServiceConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "environment must not be null");
        try {
            return new Builder()
                    .healthPort(Integer.parseInt(env(env, "HEALTH_PORT", "8080")))
                    .engineConfigPath(env(env, "ENGINE_CONFIG_PATH", ""))
                    .statusLogInterval(Integer.parseInt(env(env, "STATUS_LOG_INTERVAL", "100")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getHealthPort() {
        return healthPort;
    }

    /**
     * @return path of the engine YAML file, or an empty string to use the
     *         classpath default
     */
    public String getEngineConfigPath() {
        return engineConfigPath;
    }

    public int getStatusLogInterval() {
        return statusLogInterval;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * {@link #build()} checks that the port is in [1, 65535] and the status
     * log interval is positive.
     * </p>
     */
    public static class Builder {
        private int healthPort = 8080;
        private String engineConfigPath = "";
        private int statusLogInterval = 100;

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        public Builder engineConfigPath(String v) {
            this.engineConfigPath = v;
            return this;
        }

        public Builder statusLogInterval(int v) {
            this.statusLogInterval = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            Objects.requireNonNull(engineConfigPath, "engineConfigPath required");
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            if (statusLogInterval < 1) {
                throw new IllegalArgumentException(
                        "statusLogInterval must be >= 1, got: " + statusLogInterval);
            }
            return new ServiceConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "healthPort=" + healthPort +
                ", engineConfigPath='" + engineConfigPath + '\'' +
                ", statusLogInterval=" + statusLogInterval +
                '}';
    }
}
