package com.checkpoint.core.retention;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * User configuration of the {@link ArtifactReclaimer}.
 *
 * <p>Loaded from the {@code [cleanup]} table of a TOML file by {@link CleanupConfigLoader}.
 *
 * <p><b>Example TOML:</b>
 * <pre>{@code
 * [cleanup]
 * storage_threshold = 85.0
 * max_retention_days = 7
 * exclude_patterns = ["checkpoint-keep-*"]
 *
 * [[cleanup.custom_patterns]]
 * pattern = "audit-*.log"
 * description = "Audit logs"
 * enabled = true
 * }</pre>
 *
 * @param storageThreshold storage usage percentage above which cleanup is suggested
 * @param maxRetentionDays maximum age of temporary files (informational)
 * @param customPatterns extra include rules, appended to the defaults when enabled
 * @param excludePatterns globs that always win over include rules
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CleanupConfig(
    @JsonProperty("storage_threshold") double storageThreshold,
    @JsonProperty("max_retention_days") int maxRetentionDays,
    @JsonProperty("custom_patterns") List<CleanupPattern> customPatterns,
    @JsonProperty("exclude_patterns") List<String> excludePatterns
) {
    /**
     * Default storage threshold in percent.
     */
    public static final double DEFAULT_STORAGE_THRESHOLD = 80.0;

    /**
     * Compact constructor with defaults. A missing or non-positive threshold
     * falls back to {@link #DEFAULT_STORAGE_THRESHOLD}.
     */
    public CleanupConfig {
        if (storageThreshold <= 0) {
            storageThreshold = DEFAULT_STORAGE_THRESHOLD;
        }
        customPatterns = customPatterns == null ? List.of() : List.copyOf(customPatterns);
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
    }

    /**
     * Creates the configuration used when no file is present.
     *
     * @return default configuration
     */
    public static CleanupConfig defaults() {
        return new CleanupConfig(DEFAULT_STORAGE_THRESHOLD, 7, List.of(), List.of());
    }
}
