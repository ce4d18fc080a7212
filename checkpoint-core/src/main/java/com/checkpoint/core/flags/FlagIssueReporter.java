package com.checkpoint.core.flags;

import com.checkpoint.core.model.ConflictSeverity;
import com.checkpoint.core.model.Effort;
import com.checkpoint.core.model.FlagConflict;
import com.checkpoint.core.model.FlagStatus;
import com.checkpoint.core.model.ImplementationStatus;
import com.checkpoint.core.model.Issue;
import com.checkpoint.core.model.IssueCategory;
import com.checkpoint.core.model.Priority;
import com.checkpoint.core.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns reconciled flag verdicts into findings.
 */
public final class FlagIssueReporter {

    public static final String PARTIAL_IMPLEMENTATION_ID = "FLAG-PARTIAL-IMPLEMENTATION";
    public static final String MISSING_FROM_HELP_ID = "FLAG-MISSING-FROM-HELP-OUTPUT";
    public static final String CONFLICT_ID_PREFIX = "FLAG-CONFLICT-";

    private final String location;

    /**
     * @param location location attached to every finding (the configuration package)
     */
    public FlagIssueReporter(String location) {
        this.location = location;
    }

    /**
     * Converts verdicts into findings, flag by flag in list order.
     *
     * @param flags reconciled flags
     * @return findings
     */
    public List<Issue> report(List<FlagStatus> flags) {
        List<Issue> issues = new ArrayList<>();
        for (FlagStatus flag : flags) {
            issues.addAll(implementationIssues(flag));
            issues.addAll(conflictIssues(flag));
        }
        return issues;
    }

    private List<Issue> implementationIssues(FlagStatus flag) {
        List<Issue> issues = new ArrayList<>();
        String flagName = "--" + flag.getLongForm();

        if (flag.getStatus() == ImplementationStatus.PARTIALLY_IMPLEMENTED) {
            issues.add(Issue.builder(PARTIAL_IMPLEMENTATION_ID)
                .category(IssueCategory.USABILITY)
                .severity(Severity.MEDIUM)
                .priority(Priority.P2)
                .effort(Effort.MEDIUM)
                .title("Flag '" + flagName + "' is partially implemented")
                .description("The flag '" + flagName + "' is defined but not fully integrated into the configuration system.")
                .location(location)
                .suggestion("Complete the implementation of '" + flagName + "' in " + location + ".")
                .build());
        }

        if (FlagReconciliationEngine.MISSING_FROM_HELP.equals(flag.getActualBehavior())) {
            issues.add(Issue.builder(MISSING_FROM_HELP_ID)
                .category(IssueCategory.USABILITY)
                .severity(Severity.HIGH)
                .priority(Priority.P1)
                .effort(Effort.SMALL)
                .title("Flag '" + flagName + "' missing from CLI help output")
                .description("The flag '" + flagName + "' is defined in code but does not appear in the rendered help text.")
                .location(location)
                .suggestion("Ensure the flag is registered with the command used by the CLI.")
                .build());
        }
        return issues;
    }

    private List<Issue> conflictIssues(FlagStatus flag) {
        List<Issue> issues = new ArrayList<>();
        for (FlagConflict conflict : flag.getConflicts()) {
            Severity severity = conflict.severity() == ConflictSeverity.HIGH || conflict.severity() == ConflictSeverity.CRITICAL
                ? Severity.HIGH
                : Severity.MEDIUM;
            issues.add(Issue.builder(CONFLICT_ID_PREFIX + conflict.type().label().toUpperCase(Locale.ROOT))
                .category(IssueCategory.USABILITY)
                .severity(severity)
                .priority(Priority.P1)
                .effort(Effort.SMALL)
                .title("Conflict detected for flag '--" + flag.getLongForm() + "'")
                .description(conflict.description())
                .location(location)
                .suggestion("Resolve the discrepancy between the flag sources.")
                .build());
        }
        return issues;
    }
}
