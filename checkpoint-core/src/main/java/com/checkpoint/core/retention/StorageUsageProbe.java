package com.checkpoint.core.retention;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Measures how full the storage holding a directory is.
 */
@FunctionalInterface
public interface StorageUsageProbe {

    /**
     * Returns used space as a percentage of total space.
     *
     * @param directory any directory on the storage to measure
     * @return usage in percent, between 0 and 100
     * @throws IOException if the storage cannot be queried
     */
    double usagePercent(Path directory) throws IOException;

    /**
     * Probe backed by the {@link FileStore} of the directory.
     *
     * @return file-store probe
     */
    static StorageUsageProbe fileStore() {
        return directory -> {
            FileStore store = Files.getFileStore(directory);
            long total = store.getTotalSpace();
            if (total <= 0) {
                return 0.0;
            }
            long used = total - store.getUsableSpace();
            return used * 100.0 / total;
        };
    }
}
