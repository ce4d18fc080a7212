package com.checkpoint.core.model;

/**
 * Rough size of the work needed to resolve a finding.
 */
public enum Effort {
    SMALL,
    MEDIUM,
    LARGE
}
