package com.checkpoint.core.model;

/**
 * Remediation state of a finding. Engines always emit {@link #PENDING}.
 */
public enum IssueStatus {
    PENDING,
    IN_PROGRESS,
    RESOLVED,
    WONT_FIX
}
