package com.checkpoint.core.workspace;

import com.checkpoint.core.util.PathUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Workspace rooted in a uniquely named directory on disk.
 *
 * <p>{@link #cleanup()} removes the root recursively. Removing an already absent
 * root is not an error, so the workspace may be disposed by both its creator and
 * the artifact reclaimer.</p>
 */
public final class DiskWorkspace implements Workspace {

    private final Path root;
    private volatile boolean disposed;

    DiskWorkspace(Path root) {
        this.root = root;
    }

    @Override
    public String path(String... segments) {
        return root.resolve(Paths.get("", segments)).toString();
    }

    @Override
    public void writeFile(String relativePath, byte[] data) throws IOException {
        WorkspacePaths.requireContained(relativePath);
        Path target = root.resolve(relativePath);
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(target, data);
    }

    @Override
    public byte[] readFile(String relativePath) throws IOException {
        WorkspacePaths.requireContained(relativePath);
        return Files.readAllBytes(root.resolve(relativePath));
    }

    @Override
    public void cleanup() throws IOException {
        PathUtils.deleteRecursively(root);
        disposed = true;
    }

    @Override
    public boolean isDisposed() {
        return disposed;
    }

    @Override
    public Optional<Path> root() {
        return Optional.of(root);
    }

    @Override
    public String toString() {
        return "DiskWorkspace{" + root + "}";
    }
}
