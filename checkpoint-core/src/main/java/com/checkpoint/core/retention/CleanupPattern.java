package com.checkpoint.core.retention;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Glob rule selecting entries of the scratch base directory for removal.
 *
 * <p>The pattern is matched against the entry's file name only, using the
 * platform's {@code glob:} syntax (e.g., {@code checkpoint-*}, {@code *.tmp}).</p>
 *
 * @param pattern glob matched against entry names
 * @param description human-readable explanation of the target
 * @param enabled whether the rule takes part in matching
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CleanupPattern(
    @JsonProperty("pattern") String pattern,
    @JsonProperty("description") String description,
    @JsonProperty("enabled") boolean enabled
) {
    /**
     * Compact constructor with validation.
     */
    public CleanupPattern {
        Objects.requireNonNull(pattern, "pattern must not be null");
        if (description == null) {
            description = "";
        }
    }

    /**
     * Creates an enabled rule.
     *
     * @param pattern glob
     * @param description explanation
     * @return enabled pattern
     */
    public static CleanupPattern of(String pattern, String description) {
        return new CleanupPattern(pattern, description, true);
    }
}
