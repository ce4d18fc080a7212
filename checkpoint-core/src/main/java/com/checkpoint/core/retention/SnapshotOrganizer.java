package com.checkpoint.core.retention;

import com.checkpoint.core.model.SnapshotInfo;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Organizes and archives snapshots of produced audit artifacts.
 *
 * @see Archivist
 * @see ArtifactLayout
 */
public interface SnapshotOrganizer {

    /**
     * Copies the current {@code latest} artifacts into a new snapshot directory.
     *
     * @param name snapshot name, or empty for {@code snapshot_<timestamp>}
     * @return the created snapshot directory
     * @throws IOException if latest is missing or empty, the name is invalid, or copying fails
     */
    Path createSnapshot(String name) throws IOException;

    /**
     * Moves every snapshot except the newest {@code maxActive} into the current monthly bucket.
     *
     * @param maxActive number of snapshots to keep active
     * @return names of the archived snapshots
     * @throws IOException if the bucket cannot be created or a snapshot cannot be moved
     */
    List<String> archiveOldSnapshots(int maxActive) throws IOException;

    /**
     * Removes monthly buckets older than the retention period.
     *
     * @param retentionMonths number of months to keep
     * @return names of the removed buckets
     * @throws IOException if the archive directory cannot be listed
     */
    List<String> cleanupArchives(int retentionMonths) throws IOException;

    /**
     * Lists the snapshots currently under the active directory.
     *
     * @return snapshot details ordered by modification time, empty if there are none
     * @throws IOException if the snapshots directory exists but cannot be listed
     */
    List<SnapshotInfo> getActiveSnapshots() throws IOException;
}
