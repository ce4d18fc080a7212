package com.checkpoint.core.model;

import java.util.Objects;

/**
 * A single finding produced by an analysis engine.
 *
 * <p>Issues are immutable once created. Report renderers consume them sorted
 * with {@link IssueOrdering#forReport()}.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Issue issue = Issue.builder("FLAG-CONFLICT-ORPHANEDFLAG")
 *     .category(IssueCategory.USABILITY)
 *     .severity(Severity.HIGH)
 *     .priority(Priority.P1)
 *     .title("Conflict detected for flag '--verbose'")
 *     .location("src/main/java/com/example/config/Flags.java")
 *     .build();
 * }</pre>
 *
 * @param id stable category code (e.g., "ENGINE-TASK-FAILURE")
 * @param category area of the finding
 * @param severity how bad the finding is
 * @param priority remediation urgency
 * @param title one-line summary
 * @param description detailed explanation
 * @param location file:line or path the finding refers to
 * @param suggestion recommended fix
 * @param effort estimated remediation effort
 * @param status remediation state, {@link IssueStatus#PENDING} when not given
 */
public record Issue(
    String id,
    IssueCategory category,
    Severity severity,
    Priority priority,
    String title,
    String description,
    String location,
    String suggestion,
    Effort effort,
    IssueStatus status
) {
    /**
     * Compact constructor with validation and defaults.
     */
    public Issue {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(priority, "priority must not be null");
        if (title == null) {
            title = "";
        }
        if (description == null) {
            description = "";
        }
        if (location == null) {
            location = "";
        }
        if (suggestion == null) {
            suggestion = "";
        }
        if (effort == null) {
            effort = Effort.SMALL;
        }
        if (status == null) {
            status = IssueStatus.PENDING;
        }
    }

    /**
     * Starts building an issue with the given ID.
     *
     * @param id stable category code
     * @return new builder
     */
    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Builder for {@link Issue}. Category defaults to CODE_QUALITY, severity to
     * MEDIUM and priority to P2.
     */
    public static final class Builder {
        private final String id;
        private IssueCategory category = IssueCategory.CODE_QUALITY;
        private Severity severity = Severity.MEDIUM;
        private Priority priority = Priority.P2;
        private String title;
        private String description;
        private String location;
        private String suggestion;
        private Effort effort;
        private IssueStatus status;

        private Builder(String id) {
            this.id = id;
        }

        public Builder category(IssueCategory category) {
            this.category = category;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder suggestion(String suggestion) {
            this.suggestion = suggestion;
            return this;
        }

        public Builder effort(Effort effort) {
            this.effort = effort;
            return this;
        }

        public Builder status(IssueStatus status) {
            this.status = status;
            return this;
        }

        public Issue build() {
            return new Issue(id, category, severity, priority, title, description,
                location, suggestion, effort, status);
        }
    }
}
