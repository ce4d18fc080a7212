package com.checkpoint.core.config;

import com.checkpoint.core.flags.FlagAuditSettings;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration of a self-audit.
 *
 * <p>Loaded from {@code checkpoint.yaml} in the project root. Every block is optional;
 * missing blocks and values fall back to their defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "my-tool"
 *
 * flags:
 *   configPackage: config
 *   mainSource: src/main/java/com/example/Main.java
 *   fieldOverrides:
 *     dry-run: Preview
 *
 * retention:
 *   artifactRoot: checkpoint-artifacts
 *   maxActiveSnapshots: 10
 *   archiveRetentionMonths: 6
 *   cleanupConfig: .checkpoint.toml
 * }</pre>
 *
 * @param project project metadata
 * @param flags flag reconciliation settings
 * @param retention artifact retention settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("flags") FlagAuditSettings flags,
    @JsonProperty("retention") RetentionSettings retention
) {
    public AuditConfig {
        if (project == null) {
            project = new ProjectInfo(null);
        }
        if (flags == null) {
            flags = FlagAuditSettings.defaults();
        }
        if (retention == null) {
            retention = RetentionSettings.defaults();
        }
    }

    /**
     * Creates the configuration used when no file is present.
     *
     * @return default configuration
     */
    public static AuditConfig defaults() {
        return new AuditConfig(null, null, null);
    }

    /**
     * Project metadata.
     *
     * @param name project name
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(@JsonProperty("name") String name) {
        public ProjectInfo {
            if (name == null || name.isBlank()) {
                name = "project";
            }
        }
    }

    /**
     * Artifact retention settings.
     *
     * @param artifactRoot root of the latest/snapshots/archive layout, relative to the project root
     * @param maxActiveSnapshots snapshots kept active before archival
     * @param archiveRetentionMonths months an archive bucket is kept
     * @param cleanupConfig TOML file configuring temporary-file cleanup
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RetentionSettings(
        @JsonProperty("artifactRoot") String artifactRoot,
        @JsonProperty("maxActiveSnapshots") Integer maxActiveSnapshots,
        @JsonProperty("archiveRetentionMonths") Integer archiveRetentionMonths,
        @JsonProperty("cleanupConfig") String cleanupConfig
    ) {
        public RetentionSettings {
            if (artifactRoot == null || artifactRoot.isBlank()) {
                artifactRoot = "checkpoint-artifacts";
            }
            if (maxActiveSnapshots == null) {
                maxActiveSnapshots = 10;
            }
            if (archiveRetentionMonths == null) {
                archiveRetentionMonths = 6;
            }
            if (cleanupConfig == null || cleanupConfig.isBlank()) {
                cleanupConfig = ".checkpoint.toml";
            }
        }

        public static RetentionSettings defaults() {
            return new RetentionSettings(null, null, null, null);
        }
    }
}
