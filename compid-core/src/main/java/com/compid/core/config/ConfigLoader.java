package com.compid.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading compid configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code compid.yaml} into {@link CompidConfig} records.
 * If the config file is missing, empty or invalid, returns {@link CompidConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CompidConfig config = ConfigLoader.load(Path.of("compid.yaml"));
 * VersionRangeAlgebra algebra =
 *     new VersionRangeAlgebra(DottedVersionComparator.INSTANCE, config.intersectionMode());
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Default configuration file name. */
    public static final String DEFAULT_FILE_NAME = "compid.yaml";

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file. Never throws.
     *
     * @param configPath path to {@code compid.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static CompidConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return CompidConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return CompidConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            CompidConfig config = YAML_MAPPER.readValue(configPath.toFile(), CompidConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return CompidConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return CompidConfig.defaults();
        }
    }
}
