package com.stridegraph.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading StrideGraph configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code stridegraph.yaml} into {@link StrideConfig} records.
 * {@link #load(Path)} is lenient and returns {@link StrideConfig#defaults()} when the file is
 * missing or invalid; {@link #loadStrict(Path)} reports the problem instead.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * StrideConfig config = ConfigLoader.load(Paths.get("stridegraph.yaml"));
 * double threshold = config.analysis().confidenceThreshold();
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link StrideConfig#defaults()}.
     *
     * @param configPath path to {@code stridegraph.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static StrideConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return StrideConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return StrideConfig.defaults();
        }

        try {
            return loadStrict(configPath);
        } catch (ConfigurationException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return StrideConfig.defaults();
        }
    }

    /**
     * Loads configuration from a YAML file, failing on any problem.
     *
     * @param configPath path to {@code stridegraph.yaml}
     * @return loaded configuration
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public static StrideConfig loadStrict(Path configPath) {
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            throw new ConfigurationException("Configuration file is missing or unreadable: " + configPath);
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            StrideConfig config = YAML_MAPPER.readValue(configPath.toFile(), StrideConfig.class);
            if (config == null) {
                throw new ConfigurationException("Configuration file is empty: " + configPath);
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Invalid configuration file " + configPath + ": " + e.getMessage(), e);
        }
    }
}
