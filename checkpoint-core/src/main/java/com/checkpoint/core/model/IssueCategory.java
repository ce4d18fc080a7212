package com.checkpoint.core.model;

/**
 * Area of the codebase a finding belongs to.
 *
 * @since 1.0.0
 */
public enum IssueCategory {
    CODE_QUALITY,
    DOCUMENTATION,
    TESTING,
    SECURITY,
    PERFORMANCE,
    USABILITY
}
