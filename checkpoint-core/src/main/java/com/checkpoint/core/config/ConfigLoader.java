package com.checkpoint.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the audit configuration from {@code checkpoint.yaml}.
 *
 * <p>If the file is missing or invalid, returns {@link AuditConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AuditConfig config = ConfigLoader.load(root.resolve(ConfigLoader.DEFAULT_FILE_NAME));
 * int keep = config.retention().maxActiveSnapshots();
 * }</pre>
 */
public class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "checkpoint.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file, never throwing.
     *
     * @param configPath path to {@code checkpoint.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static AuditConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return AuditConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return AuditConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            AuditConfig config = YAML_MAPPER.readValue(configPath.toFile(), AuditConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return AuditConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return AuditConfig.defaults();
        }
    }
}
