package com.checkpoint.core.engine;

import com.checkpoint.core.model.Issue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Thread-safe accumulator of findings from concurrently running engines.
 */
public final class IssueCollector {

    private final Object lock = new Object();
    private final List<Issue> issues = new ArrayList<>();

    /**
     * Appends a batch of findings.
     *
     * @param batch findings of one engine
     */
    public void collect(Collection<Issue> batch) {
        synchronized (lock) {
            issues.addAll(batch);
        }
    }

    /**
     * Returns an immutable snapshot of everything collected so far.
     *
     * @return copy of the findings, never a live view
     */
    public List<Issue> issues() {
        synchronized (lock) {
            return List.copyOf(issues);
        }
    }

    /**
     * Drops every collected finding.
     */
    public void clear() {
        synchronized (lock) {
            issues.clear();
        }
    }
}
