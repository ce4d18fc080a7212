package com.checkpoint.core.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Factory methods for the two workspace backends.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Workspace scratch = Workspaces.onDisk();
 * try {
 *     scratch.writeFile("flags/help.txt", helpText.getBytes(StandardCharsets.UTF_8));
 * } finally {
 *     scratch.cleanup();
 * }
 * }</pre>
 */
public final class Workspaces {

    /**
     * Directory name prefix of disk workspaces, matched by the reclaimer's
     * default {@code checkpoint-*} pattern.
     */
    public static final String DISK_PREFIX = "checkpoint-workspace-";

    private static final Logger log = LoggerFactory.getLogger(Workspaces.class);

    private Workspaces() {
        // Utility class
    }

    /**
     * Creates a workspace with no filesystem footprint.
     *
     * @return in-memory workspace
     */
    public static Workspace inMemory() {
        return new InMemoryWorkspace();
    }

    /**
     * Creates a disk workspace in the system temporary directory.
     *
     * @return disk workspace
     * @throws IOException if the root directory cannot be created
     */
    public static Workspace onDisk() throws IOException {
        Path root = Files.createTempDirectory(DISK_PREFIX);
        log.debug("Created workspace root: {}", root);
        return new DiskWorkspace(root);
    }

    /**
     * Creates a disk workspace below the given parent directory.
     *
     * @param parent directory that will hold the workspace root
     * @return disk workspace
     * @throws IOException if the root directory cannot be created
     */
    public static Workspace onDisk(Path parent) throws IOException {
        Files.createDirectories(parent);
        Path root = Files.createTempDirectory(parent, DISK_PREFIX);
        log.debug("Created workspace root: {}", root);
        return new DiskWorkspace(root);
    }

    /**
     * Returns a factory for either backend.
     *
     * @param inMemory true for the in-memory backend
     * @return workspace factory
     */
    public static WorkspaceFactory factory(boolean inMemory) {
        return inMemory ? Workspaces::inMemory : Workspaces::onDisk;
    }
}
