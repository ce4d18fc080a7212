package com.checkpoint.core.model;

/**
 * Severity of a {@link FlagConflict}.
 */
public enum ConflictSeverity {
    MEDIUM,
    HIGH,
    CRITICAL
}
