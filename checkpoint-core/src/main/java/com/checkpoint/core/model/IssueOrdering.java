package com.checkpoint.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Ordering applied to findings before they are handed to report renderers.
 */
public final class IssueOrdering {

    private static final Comparator<Issue> FOR_REPORT = Comparator
        .comparing(Issue::priority)
        .thenComparing(Issue::severity)
        .thenComparing(Issue::id);

    private IssueOrdering() {
        // Utility class
    }

    /**
     * Priority ascending (P0 first), then severity descending (CRITICAL first),
     * then ID for a stable result.
     *
     * @return report comparator
     */
    public static Comparator<Issue> forReport() {
        return FOR_REPORT;
    }

    /**
     * Returns a new list holding the given issues in report order.
     *
     * @param issues issues to sort
     * @return sorted, unmodifiable copy
     */
    public static List<Issue> sortForReport(Collection<Issue> issues) {
        List<Issue> sorted = new ArrayList<>(issues);
        sorted.sort(FOR_REPORT);
        return List.copyOf(sorted);
    }
}
