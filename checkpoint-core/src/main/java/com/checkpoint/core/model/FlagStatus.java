package com.checkpoint.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Reconciliation record for one command-line flag.
 *
 * <p>Unlike the other model types this class is mutable: the catalog phase
 * creates one instance per declaration and every later phase of the flag
 * reconciliation updates it in place. Conflicts are append-only.</p>
 *
 * <p>{@link #getStatus()} is {@code null} until the flag has been classified.</p>
 *
 * @since 1.0.0
 */
public final class FlagStatus {

    private final String name;
    private final String longForm;
    private String shortForm = "";
    private String description = "";
    private ImplementationStatus status;
    private boolean definedInCode;
    private boolean definedInHelp;
    private boolean definedInDocs;
    private boolean definedInPlanning;
    private boolean testCoverage;
    private String actualBehavior = "";
    private final List<FlagConflict> conflicts = new ArrayList<>();

    /**
     * Creates a flag record whose name equals its long form.
     *
     * @param longForm flag name without the leading marker (e.g., "dry-run")
     */
    public FlagStatus(String longForm) {
        this(longForm, longForm);
    }

    /**
     * Creates a flag record.
     *
     * @param name display name
     * @param longForm flag name without the leading marker
     */
    public FlagStatus(String name, String longForm) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.longForm = Objects.requireNonNull(longForm, "longForm must not be null");
    }

    /**
     * Creates the record of a flag found only in planning text.
     *
     * @param longForm flag name without the leading marker
     * @return planned, undeclared flag
     */
    public static FlagStatus ghost(String longForm) {
        FlagStatus ghost = new FlagStatus(longForm);
        ghost.setDefinedInPlanning(true);
        ghost.setStatus(ImplementationStatus.PLANNED_NOT_IMPLEMENTED);
        return ghost;
    }

    public String getName() {
        return name;
    }

    public String getLongForm() {
        return longForm;
    }

    public String getShortForm() {
        return shortForm;
    }

    public void setShortForm(String shortForm) {
        this.shortForm = shortForm != null ? shortForm : "";
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description != null ? description : "";
    }

    public ImplementationStatus getStatus() {
        return status;
    }

    public void setStatus(ImplementationStatus status) {
        this.status = status;
    }

    public boolean isDefinedInCode() {
        return definedInCode;
    }

    public void setDefinedInCode(boolean definedInCode) {
        this.definedInCode = definedInCode;
    }

    public boolean isDefinedInHelp() {
        return definedInHelp;
    }

    public void setDefinedInHelp(boolean definedInHelp) {
        this.definedInHelp = definedInHelp;
    }

    public boolean isDefinedInDocs() {
        return definedInDocs;
    }

    public void setDefinedInDocs(boolean definedInDocs) {
        this.definedInDocs = definedInDocs;
    }

    public boolean isDefinedInPlanning() {
        return definedInPlanning;
    }

    public void setDefinedInPlanning(boolean definedInPlanning) {
        this.definedInPlanning = definedInPlanning;
    }

    public boolean hasTestCoverage() {
        return testCoverage;
    }

    public void setTestCoverage(boolean testCoverage) {
        this.testCoverage = testCoverage;
    }

    public String getActualBehavior() {
        return actualBehavior;
    }

    public void setActualBehavior(String actualBehavior) {
        this.actualBehavior = actualBehavior != null ? actualBehavior : "";
    }

    /**
     * Returns the conflicts recorded so far, in detection order.
     *
     * @return read-only view of the conflicts
     */
    public List<FlagConflict> getConflicts() {
        return Collections.unmodifiableList(conflicts);
    }

    /**
     * Appends a conflict. Conflicts are never removed.
     *
     * @param conflict conflict to record
     */
    public void addConflict(FlagConflict conflict) {
        conflicts.add(Objects.requireNonNull(conflict, "conflict must not be null"));
    }

    /**
     * Checks whether a conflict of the given type has already been recorded.
     *
     * @param type conflict type
     * @return true if present
     */
    public boolean hasConflict(ConflictType type) {
        return conflicts.stream().anyMatch(c -> c.type() == type);
    }

    @Override
    public String toString() {
        return "FlagStatus{--" + longForm + ", status=" + status + ", conflicts=" + conflicts.size() + "}";
    }
}
