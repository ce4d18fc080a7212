package com.checkpoint.core.workspace;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Workspace backed by a concurrent map of normalized virtual paths to bytes.
 *
 * <p>Directories are implicit. Disposal drops the backing map; any later read or
 * write fails with {@link IllegalStateException}.</p>
 */
public final class InMemoryWorkspace implements Workspace {

    private static final Path VIRTUAL_ROOT = Paths.get("/");

    private volatile Map<String, byte[]> files = new ConcurrentHashMap<>();

    InMemoryWorkspace() {
    }

    @Override
    public String path(String... segments) {
        return VIRTUAL_ROOT.resolve(Paths.get("", segments)).normalize().toString();
    }

    @Override
    public void writeFile(String relativePath, byte[] data) throws IOException {
        WorkspacePaths.requireContained(relativePath);
        backing().put(path(relativePath), Arrays.copyOf(data, data.length));
    }

    @Override
    public byte[] readFile(String relativePath) throws IOException {
        WorkspacePaths.requireContained(relativePath);
        byte[] data = backing().get(path(relativePath));
        if (data == null) {
            throw new NoSuchFileException(path(relativePath));
        }
        return Arrays.copyOf(data, data.length);
    }

    @Override
    public void cleanup() {
        files = null;
    }

    @Override
    public boolean isDisposed() {
        return files == null;
    }

    @Override
    public Optional<Path> root() {
        return Optional.empty();
    }

    private Map<String, byte[]> backing() {
        Map<String, byte[]> current = files;
        if (current == null) {
            throw new IllegalStateException("workspace has been disposed");
        }
        return current;
    }
}
