package com.checkpoint.core.model;

import java.util.Objects;

/**
 * Disagreement between two provenance sources about one flag.
 *
 * @param type kind of conflict
 * @param source1 first source (e.g., "code")
 * @param source2 second source (e.g., "documentation")
 * @param description plain-text explanation, safe for direct embedding in reports
 * @param severity conflict severity
 */
public record FlagConflict(
    ConflictType type,
    String source1,
    String source2,
    String description,
    ConflictSeverity severity
) {
    /**
     * Compact constructor with validation.
     */
    public FlagConflict {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(source1, "source1 must not be null");
        Objects.requireNonNull(source2, "source2 must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        if (description == null) {
            description = "";
        }
    }
}
