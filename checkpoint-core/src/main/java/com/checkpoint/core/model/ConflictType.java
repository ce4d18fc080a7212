package com.checkpoint.core.model;

/**
 * Kind of disagreement between two sources describing a flag.
 */
public enum ConflictType {
    /**
     * Declared in code, absent from help text and user documentation.
     */
    ORPHANED_FLAG("OrphanedFlag"),

    /**
     * Declared in code, absent from user documentation only.
     */
    DESCRIPTION_CONFLICT("DescriptionConflict"),

    /**
     * Mentioned in planning documents but never declared in code.
     */
    PLANNING_MISMATCH("PlanningMismatch");

    private final String label;

    ConflictType(String label) {
        this.label = label;
    }

    /**
     * Returns the label used in issue IDs and reports (e.g., "OrphanedFlag").
     *
     * @return conflict label
     */
    public String label() {
        return label;
    }
}
