package com.checkpoint.core.workspace;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Disposable, sandboxed scratch storage handed to analysis engines.
 *
 * <p>Two backends exist: {@link InMemoryWorkspace} (no filesystem footprint) and
 * {@link DiskWorkspace} (a freshly created, uniquely named directory). Engines
 * address files by relative path only; any path containing a {@code ..} segment
 * is rejected with a {@link PathTraversalException} on both read and write.</p>
 *
 * <p>A workspace is shared by every engine of a run. Engines that need isolation
 * should write below their own relative subdirectory.</p>
 *
 * @see Workspaces
 * @since 1.0.0
 */
public interface Workspace {

    /**
     * Joins the given segments against the workspace root.
     *
     * <p>The disk backend uses its root directory; the in-memory backend uses a
     * virtual root {@code /}.</p>
     *
     * @param segments path segments
     * @return joined path as a string
     */
    String path(String... segments);

    /**
     * Writes a file, creating intermediate directories as needed.
     *
     * @param relativePath path relative to the workspace root
     * @param data file contents
     * @throws PathTraversalException if the path contains a {@code ..} segment
     * @throws IOException if the write fails
     */
    void writeFile(String relativePath, byte[] data) throws IOException;

    /**
     * Reads a file previously written to this workspace.
     *
     * @param relativePath path relative to the workspace root
     * @return file contents
     * @throws PathTraversalException if the path contains a {@code ..} segment
     * @throws IOException if the file does not exist or cannot be read
     */
    byte[] readFile(String relativePath) throws IOException;

    /**
     * Releases every resource held by this workspace. Idempotent.
     *
     * @throws IOException if the disk backend cannot remove its root
     */
    void cleanup() throws IOException;

    /**
     * Returns true once {@link #cleanup()} has completed.
     *
     * @return disposal state
     */
    boolean isDisposed();

    /**
     * Returns the root directory of a disk-backed workspace.
     *
     * @return root directory, empty for the in-memory backend
     */
    Optional<Path> root();
}
