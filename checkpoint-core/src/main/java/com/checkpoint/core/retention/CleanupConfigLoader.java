package com.checkpoint.core.retention;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads the {@code [cleanup]} table of a TOML configuration file.
 */
public final class CleanupConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(CleanupConfigLoader.class);
    private static final TomlMapper TOML_MAPPER = new TomlMapper();

    private CleanupConfigLoader() {
        // Utility class
    }

    /**
     * Loads cleanup configuration.
     *
     * @param configPath TOML file
     * @return configuration, empty if the file does not exist or has no {@code [cleanup]} table
     * @throws IOException if the file exists but cannot be read or decoded
     */
    public static Optional<CleanupConfig> load(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            log.debug("Cleanup configuration not found: {}", configPath);
            return Optional.empty();
        }
        try {
            ConfigFile file = TOML_MAPPER.readValue(configPath.toFile(), ConfigFile.class);
            log.info("Loaded cleanup configuration from: {}", configPath);
            return Optional.ofNullable(file.cleanup());
        } catch (IOException e) {
            throw new IOException("failed to decode config file " + configPath + ": " + e.getMessage(), e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ConfigFile(@JsonProperty("cleanup") CleanupConfig cleanup) {
    }
}
