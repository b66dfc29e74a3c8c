package com.powersentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link EngineConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <p>
 * Every {@code load*} method validates after parsing so that a bad
 * configuration fails at startup. An empty document yields the defaults.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EngineConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "ENGINE_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "engine.yml";

    private EngineConfigLoader() {
        // utility class — not instantiable
    }

    /**
     * Load using automatic resolution: {@code ENGINE_CONFIG_PATH} when set and
     * the file exists, otherwise {@value #DEFAULT_RESOURCE} on the classpath.
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static EngineConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading engine configuration from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading engine configuration from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static EngineConfig fromFile(String path) {
        Objects.requireNonNull(path, "Engine config path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Engine config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read engine config file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static EngineConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = EngineConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static EngineConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(EngineConfig.class, options));

        EngineConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed engine configuration: " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Engine configuration is empty, using defaults");
            config = new EngineConfig();
        }
        if (config.getThresholds() == null) {
            config.setThresholds(new DetectionThresholds());
        }
        config.validate();

        LOG.info("Loaded {}", config);
        return config;
    }
}
