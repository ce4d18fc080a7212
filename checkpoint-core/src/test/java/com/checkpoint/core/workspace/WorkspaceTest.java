package com.checkpoint.core.workspace;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for both {@link Workspace} backends.
 */
class WorkspaceTest {

    @TempDir
    Path tempDir;

    @Test
    void inMemory_writeThenRead_returnsOriginalBytes() throws IOException {
        Workspace workspace = Workspaces.inMemory();
        byte[] data = {0, 1, 2, (byte) 0xFF};

        workspace.writeFile("nested/dir/data.bin", data);

        assertThat(workspace.readFile("nested/dir/data.bin")).containsExactly(data);
    }

    @Test
    void inMemory_returnedBytesAreCopies() throws IOException {
        Workspace workspace = Workspaces.inMemory();
        byte[] data = "abc".getBytes(StandardCharsets.UTF_8);

        workspace.writeFile("a.txt", data);
        data[0] = 'x';
        workspace.readFile("a.txt")[1] = 'y';

        assertThat(new String(workspace.readFile("a.txt"), StandardCharsets.UTF_8)).isEqualTo("abc");
    }

    @Test
    void inMemory_equivalentPaths_resolveToSameEntry() throws IOException {
        Workspace workspace = Workspaces.inMemory();

        workspace.writeFile("./a/./b.txt", new byte[] {7});

        assertThat(workspace.readFile("a/b.txt")).containsExactly(7);
        assertThat(workspace.path("a", "b.txt")).isEqualTo(Path.of("/a/b.txt").toString());
        assertThat(workspace.root()).isEmpty();
    }

    @Test
    void inMemory_missingFile_throwsNoSuchFile() {
        Workspace workspace = Workspaces.inMemory();

        assertThatThrownBy(() -> workspace.readFile("missing.txt"))
            .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void inMemory_afterCleanup_rejectsAccess() throws IOException {
        Workspace workspace = Workspaces.inMemory();
        workspace.writeFile("a.txt", new byte[] {1});

        workspace.cleanup();

        assertThat(workspace.isDisposed()).isTrue();
        assertThatThrownBy(() -> workspace.readFile("a.txt"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("disposed");
        assertThatThrownBy(() -> workspace.writeFile("b.txt", new byte[] {1}))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void onDisk_writeThenRead_returnsOriginalBytes() throws IOException {
        Workspace workspace = Workspaces.onDisk(tempDir);
        byte[] data = "hello workspace".getBytes(StandardCharsets.UTF_8);

        workspace.writeFile("reports/out.txt", data);

        assertThat(workspace.readFile("reports/out.txt")).containsExactly(data);
        Path root = workspace.root().orElseThrow();
        assertThat(root.getFileName().toString()).startsWith(Workspaces.DISK_PREFIX);
        assertThat(root.resolve("reports/out.txt")).exists();
        assertThat(workspace.path("reports", "out.txt")).isEqualTo(root.resolve("reports/out.txt").toString());
    }

    @Test
    void onDisk_cleanup_removesRootAndIsIdempotent() throws IOException {
        Workspace workspace = Workspaces.onDisk(tempDir);
        workspace.writeFile("a/b/c.txt", new byte[] {1});
        Path root = workspace.root().orElseThrow();

        workspace.cleanup();
        workspace.cleanup();

        assertThat(root).doesNotExist();
        assertThat(workspace.isDisposed()).isTrue();
    }

    @Test
    void onDisk_rootRemovedExternally_cleanupSucceeds() throws IOException {
        Workspace workspace = Workspaces.onDisk(tempDir);
        Files.delete(workspace.root().orElseThrow());

        workspace.cleanup();

        assertThat(workspace.isDisposed()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"../escape.txt", "a/../../escape.txt", "a/..", "..\\escape.txt", "/etc/passwd"})
    void traversal_rejectedOnBothBackends(String path) throws IOException {
        Workspace memory = Workspaces.inMemory();
        Workspace disk = Workspaces.onDisk(tempDir);

        assertThatThrownBy(() -> memory.writeFile(path, new byte[] {1})).isInstanceOf(PathTraversalException.class);
        assertThatThrownBy(() -> memory.readFile(path)).isInstanceOf(PathTraversalException.class);
        assertThatThrownBy(() -> disk.writeFile(path, new byte[] {1})).isInstanceOf(PathTraversalException.class);
        assertThatThrownBy(() -> disk.readFile(path)).isInstanceOf(PathTraversalException.class);
    }

    @Test
    void traversal_fileNamesContainingDots_areAllowed() throws IOException {
        Workspace workspace = Workspaces.inMemory();

        workspace.writeFile("notes..txt", new byte[] {3});

        assertThat(workspace.readFile("notes..txt")).containsExactly(3);
    }

    @Test
    void factory_selectsBackend() throws IOException {
        Workspace memory = Workspaces.factory(true).create();
        Workspace disk = Workspaces.factory(false).create();
        try {
            assertThat(memory).isInstanceOf(InMemoryWorkspace.class);
            assertThat(disk).isInstanceOf(DiskWorkspace.class);
        } finally {
            disk.cleanup();
        }
    }
}
