package com.checkpoint.core.retention;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one {@link ArtifactReclaimer#cleanupTemporaryFiles()} call.
 *
 * <p>In dry-run mode the counters describe what would have been removed.</p>
 *
 * @param filesRemoved individual files deleted
 * @param dirsRemoved directories deleted, workspaces included
 * @param spaceFreed total size in bytes of the removed items
 * @param errors one message per item that could not be removed
 * @param duration wall time of the operation
 * @param storageUsageBefore storage usage percentage before cleanup
 * @param storageUsageAfter storage usage percentage after cleanup
 * @param dryRun whether removal was simulated
 */
public record CleanupResult(
    int filesRemoved,
    int dirsRemoved,
    long spaceFreed,
    List<String> errors,
    Duration duration,
    double storageUsageBefore,
    double storageUsageAfter,
    boolean dryRun
) {
    /**
     * Compact constructor with defaults.
     */
    public CleanupResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        if (duration == null) {
            duration = Duration.ZERO;
        }
    }

    /**
     * Returns true if any item could not be removed.
     *
     * @return whether errors were recorded
     */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Mutable accumulator used while a cleanup is in progress.
     */
    static final class Builder {
        int filesRemoved;
        int dirsRemoved;
        long spaceFreed;
        final List<String> errors = new ArrayList<>();
        double storageUsageBefore;
        double storageUsageAfter;
        final boolean dryRun;

        Builder(boolean dryRun) {
            this.dryRun = dryRun;
        }

        CleanupResult build(Duration duration) {
            return new CleanupResult(filesRemoved, dirsRemoved, spaceFreed, errors, duration,
                storageUsageBefore, storageUsageAfter, dryRun);
        }
    }
}
