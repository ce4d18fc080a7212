package com.checkpoint.core.model;

/**
 * Severity of a finding.
 *
 * <p>Declaration order is significant: constants are declared from most to
 * least severe, so natural enum ordering sorts the worst findings first.</p>
 *
 * @since 1.0.0
 */
public enum Severity {
    /**
     * Breaks the build, the release, or user data.
     */
    CRITICAL,

    /**
     * Visible defect that should be fixed before the next release.
     */
    HIGH,

    /**
     * Inconsistency worth scheduling.
     */
    MEDIUM,

    /**
     * Cosmetic or minor maintainability concern.
     */
    LOW,

    /**
     * Informational only, no action required.
     */
    INFO
}
