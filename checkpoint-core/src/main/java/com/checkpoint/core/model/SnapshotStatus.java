package com.checkpoint.core.model;

/**
 * Lifecycle state of a report snapshot.
 */
public enum SnapshotStatus {
    /**
     * Lives under the active snapshots directory.
     */
    ACTIVE,

    /**
     * Moved into a monthly archive bucket.
     */
    ARCHIVED
}
