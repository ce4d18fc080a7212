package com.checkpoint.core.retention;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Three-tier layout of persisted audit artifacts below one root directory.
 *
 * <pre>
 * root/
 *   active/
 *     latest/       raw artifacts of the most recent run
 *     snapshots/    timestamped copies of latest
 *   archive/
 *     2026-10/      monthly buckets of archived snapshots
 * </pre>
 *
 * @param root artifact root directory
 */
public record ArtifactLayout(Path root) {

    public ArtifactLayout {
        Objects.requireNonNull(root, "root must not be null");
    }

    public Path activeDir() {
        return root.resolve("active");
    }

    public Path latestDir() {
        return activeDir().resolve("latest");
    }

    public Path snapshotsDir() {
        return activeDir().resolve("snapshots");
    }

    public Path archiveDir() {
        return root.resolve("archive");
    }
}
