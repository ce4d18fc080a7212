package com.checkpoint.core.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * A named, timestamped directory of produced artifacts.
 *
 * @param name snapshot directory name
 * @param timestamp last modification time of the directory
 * @param size total size in bytes of the files inside
 * @param status active or archived
 * @param path absolute location of the snapshot directory
 */
public record SnapshotInfo(
    String name,
    Instant timestamp,
    long size,
    SnapshotStatus status,
    Path path
) {
    /**
     * Compact constructor with validation.
     */
    public SnapshotInfo {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(path, "path must not be null");
    }
}
