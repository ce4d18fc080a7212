package com.checkpoint.core.model;

/**
 * Verdict on how completely a command-line flag is wired into the program.
 */
public enum ImplementationStatus {
    /**
     * Referenced from both the configuration source and the main entry source.
     */
    FULLY_IMPLEMENTED("FullyImplemented"),

    /**
     * Referenced from exactly one of the two sources.
     */
    PARTIALLY_IMPLEMENTED("PartiallyImplemented"),

    /**
     * Declared (or planned) but referenced from neither source.
     */
    PLANNED_NOT_IMPLEMENTED("PlannedNotImplemented"),

    /**
     * Known to be broken and waiting for a fix.
     */
    NEEDS_REPAIR("NeedsRepair");

    private final String label;

    ImplementationStatus(String label) {
        this.label = label;
    }

    /**
     * Returns the label used in reports (e.g., "FullyImplemented").
     *
     * @return status label
     */
    public String label() {
        return label;
    }
}
