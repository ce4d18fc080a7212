package com.checkpoint.core.retention;

/**
 * Result of {@link ArtifactReclaimer#checkStorageUsage(double)}.
 *
 * @param needsCleanup true if usage is strictly above the threshold
 * @param usagePercent measured usage in percent
 */
public record StorageCheck(boolean needsCleanup, double usagePercent) {
}
