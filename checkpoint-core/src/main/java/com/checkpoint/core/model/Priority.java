package com.checkpoint.core.model;

/**
 * Remediation priority, {@code P0} being the most urgent.
 *
 * @since 1.0.0
 */
public enum Priority {
    P0,
    P1,
    P2,
    P3
}
