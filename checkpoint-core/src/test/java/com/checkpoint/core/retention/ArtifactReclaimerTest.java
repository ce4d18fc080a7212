package com.checkpoint.core.retention;

import com.checkpoint.core.workspace.Workspace;
import com.checkpoint.core.workspace.Workspaces;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ArtifactReclaimer}.
 */
class ArtifactReclaimerTest {

    @TempDir
    Path baseDir;

    private ArtifactReclaimer reclaimer;

    @BeforeEach
    void setUp() {
        reclaimer = new ArtifactReclaimer(false, dir -> 42.0);
        reclaimer.setBaseDir(baseDir);
    }

    @Test
    void cleanup_removesMatchingFilesAndKeepsExcluded() throws IOException {
        reclaimer.applyConfig(new CleanupConfig(80.0, 7, List.of(), List.of("checkpoint-keep-*")));
        Files.writeString(baseDir.resolve("checkpoint-a.log"), "a");
        Files.writeString(baseDir.resolve("test-output.txt"), "bb");
        Files.writeString(baseDir.resolve("scratch.tmp"), "ccc");
        Files.writeString(baseDir.resolve("checkpoint-keep-me.log"), "keep");
        Files.writeString(baseDir.resolve("unrelated.txt"), "keep");

        CleanupResult result = reclaimer.cleanupTemporaryFiles();

        assertThat(result.filesRemoved()).isEqualTo(3);
        assertThat(result.dirsRemoved()).isZero();
        assertThat(result.spaceFreed()).isEqualTo(6);
        assertThat(result.errors()).isEmpty();
        assertThat(result.dryRun()).isFalse();
        assertThat(baseDir.resolve("checkpoint-keep-me.log")).exists();
        assertThat(baseDir.resolve("unrelated.txt")).exists();
        assertThat(baseDir.resolve("checkpoint-a.log")).doesNotExist();
        assertThat(baseDir.resolve("test-output.txt")).doesNotExist();
        assertThat(baseDir.resolve("scratch.tmp")).doesNotExist();
    }

    @Test
    void cleanup_matchingDirectory_isRemovedRecursively() throws IOException {
        Path dir = baseDir.resolve("checkpoint-run");
        Files.createDirectories(dir.resolve("nested"));
        Files.writeString(dir.resolve("nested/file.txt"), "12345");

        CleanupResult result = reclaimer.cleanupTemporaryFiles();

        assertThat(result.dirsRemoved()).isEqualTo(1);
        assertThat(result.filesRemoved()).isZero();
        assertThat(result.spaceFreed()).isEqualTo(5);
        assertThat(dir).doesNotExist();
    }

    @Test
    void dryRun_countsButRemovesNothing() throws IOException {
        Files.writeString(baseDir.resolve("checkpoint-a.log"), "a");
        Files.writeString(baseDir.resolve("b.tmp"), "b");
        reclaimer.setDryRun(true);

        CleanupResult result = reclaimer.cleanupTemporaryFiles();

        assertThat(result.dryRun()).isTrue();
        assertThat(result.filesRemoved()).isEqualTo(2);
        assertThat(result.storageUsageAfter()).isEqualTo(result.storageUsageBefore());
        assertThat(baseDir.resolve("checkpoint-a.log")).exists();
        assertThat(baseDir.resolve("b.tmp")).exists();
    }

    @Test
    void previewCleanup_restoresPreviousMode() throws IOException {
        Files.writeString(baseDir.resolve("x.tmp"), "x");

        CleanupResult preview = reclaimer.previewCleanup();

        assertThat(preview.dryRun()).isTrue();
        assertThat(preview.filesRemoved()).isEqualTo(1);
        assertThat(reclaimer.isDryRun()).isFalse();
        assertThat(baseDir.resolve("x.tmp")).exists();
    }

    @Test
    void cleanup_disposesTrackedDiskWorkspaces() throws IOException {
        Path elsewhere = Files.createDirectories(baseDir.resolve("elsewhere"));
        Workspace disk = Workspaces.onDisk(elsewhere);
        disk.writeFile("out.txt", new byte[] {1, 2, 3});
        Workspace memory = Workspaces.inMemory();
        reclaimer.registerWorkspace(disk);
        reclaimer.registerWorkspace(memory);

        CleanupResult result = reclaimer.cleanupTemporaryFiles();

        assertThat(result.dirsRemoved()).isEqualTo(1);
        assertThat(result.spaceFreed()).isEqualTo(3);
        assertThat(disk.isDisposed()).isTrue();
        assertThat(disk.root().orElseThrow()).doesNotExist();
        assertThat(memory.isDisposed()).isFalse();
        assertThat(reclaimer.trackedWorkspaces()).isZero();
    }

    @Test
    void cleanup_workspaceFailingToDispose_staysTracked() throws IOException {
        Path elsewhere = Files.createDirectories(baseDir.resolve("elsewhere"));
        Workspace healthy = Workspaces.onDisk(elsewhere);
        StubbornWorkspace stubborn = new StubbornWorkspace(Files.createDirectories(elsewhere.resolve("locked")));
        reclaimer.registerWorkspace(healthy);
        reclaimer.registerWorkspace(stubborn);

        CleanupResult first = reclaimer.cleanupTemporaryFiles();

        assertThat(first.errors()).singleElement().asString().contains("device busy");
        assertThat(healthy.isDisposed()).isTrue();
        assertThat(reclaimer.trackedWorkspaces()).isEqualTo(1);

        stubborn.failing = false;
        CleanupResult second = reclaimer.cleanupTemporaryFiles();

        assertThat(second.errors()).isEmpty();
        assertThat(stubborn.isDisposed()).isTrue();
        assertThat(reclaimer.trackedWorkspaces()).isZero();
    }

    @Test
    void cleanup_workspaceInsideBaseDir_isCountedOnce() throws IOException {
        Workspace disk = Workspaces.onDisk(baseDir);
        reclaimer.registerWorkspace(disk);
        reclaimer.setDryRun(true);

        CleanupResult result = reclaimer.cleanupTemporaryFiles();

        assertThat(result.dirsRemoved()).isEqualTo(1);
        assertThat(reclaimer.trackedWorkspaces()).isEqualTo(1);
    }

    @Test
    void cleanup_missingBaseDir_throwsIOException() {
        reclaimer.setBaseDir(baseDir.resolve("missing"));

        assertThatThrownBy(() -> reclaimer.cleanupTemporaryFiles())
            .isInstanceOf(IOException.class)
            .hasMessageContaining("failed to read");
    }

    @Test
    void cleanup_reportsUsageFromProbe() throws IOException {
        ArtifactReclaimer probed = new ArtifactReclaimer(true, dir -> 90.0);
        probed.setBaseDir(baseDir);
        Files.writeString(baseDir.resolve("a.tmp"), "a");

        CleanupResult result = probed.cleanupAndReport();

        assertThat(result.storageUsageBefore()).isEqualTo(90.0);
        assertThat(result.storageUsageAfter()).isEqualTo(90.0);
        assertThat(result.filesRemoved()).isEqualTo(1);
    }

    @ParameterizedTest
    @CsvSource({
        "50.0, 80.0, false",
        "80.0, 80.0, false",
        "80.1, 80.0, true",
        "0.0, 0.0, false",
        "100.0, 99.9, true"
    })
    void checkStorageUsage_usesStrictInequality(double usage, double threshold, boolean expected) {
        for (boolean verbose : new boolean[] {false, true}) {
            for (boolean dryRun : new boolean[] {false, true}) {
                ArtifactReclaimer probed = new ArtifactReclaimer(verbose, dir -> usage);
                probed.setDryRun(dryRun);

                StorageCheck check = probed.checkStorageUsage(threshold);

                assertThat(check.needsCleanup()).isEqualTo(expected);
                assertThat(check.usagePercent()).isEqualTo(usage);
            }
        }
    }

    @Test
    void checkStorageUsage_probeFailure_reportsZero() {
        ArtifactReclaimer failing = new ArtifactReclaimer(false, dir -> {
            throw new IOException("no file store");
        });

        StorageCheck check = failing.checkStorageUsage(10.0);

        assertThat(check.needsCleanup()).isFalse();
        assertThat(check.usagePercent()).isZero();
    }

    @Test
    void shouldClean_excludeWinsOverInclude() {
        reclaimer.applyConfig(new CleanupConfig(80.0, 7, List.of(), List.of("*.keep.tmp")));

        assertThat(reclaimer.shouldClean("data.tmp")).isTrue();
        assertThat(reclaimer.shouldClean("data.keep.tmp")).isFalse();
        assertThat(reclaimer.shouldClean("README.md")).isFalse();
    }

    @Test
    void applyConfig_appendsOnlyEnabledCustomPatterns() {
        reclaimer.applyConfig(new CleanupConfig(85.0, 3, List.of(
            new CleanupPattern("audit-*.log", "Audit logs", true),
            new CleanupPattern("core.*", "Core dumps", false)
        ), List.of()));

        assertThat(reclaimer.getPatterns())
            .extracting(CleanupPattern::pattern)
            .containsExactly("checkpoint-*", "test-*", "*.tmp", "audit-*.log");
        assertThat(reclaimer.shouldClean("audit-2026.log")).isTrue();
        assertThat(reclaimer.shouldClean("core.123")).isFalse();
        assertThat(reclaimer.getConfig().storageThreshold()).isEqualTo(85.0);
    }

    @Test
    void validatePatterns_invalidGlob_throwsIllegalArgument() {
        reclaimer.addCustomPattern("[unclosed", "broken");

        assertThatThrownBy(() -> reclaimer.validatePatterns())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("invalid pattern");
    }

    @Test
    void validatePatterns_invalidExclude_throwsIllegalArgument() {
        reclaimer.applyConfig(new CleanupConfig(80.0, 7, List.of(), List.of("{a,b")));

        assertThatThrownBy(() -> reclaimer.validatePatterns())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("invalid exclude pattern");
    }

    @Test
    void loadConfig_missingFile_keepsDefaults() throws IOException {
        reclaimer.loadConfig(baseDir.resolve("absent.toml"));

        assertThat(reclaimer.getPatterns()).hasSize(ArtifactReclaimer.DEFAULT_PATTERNS.size());
        assertThat(reclaimer.getConfig()).isEqualTo(CleanupConfig.defaults());
    }

    private static final class StubbornWorkspace implements Workspace {
        private final Path root;
        private boolean failing = true;
        private boolean disposed;

        StubbornWorkspace(Path root) {
            this.root = root;
        }

        @Override
        public String path(String... segments) {
            return root.resolve(String.join("/", segments)).toString();
        }

        @Override
        public void writeFile(String relativePath, byte[] data) {
            throw new UnsupportedOperationException();
        }

        @Override
        public byte[] readFile(String relativePath) {
            throw new UnsupportedOperationException();
        }

        @Override
        public void cleanup() throws IOException {
            if (failing) {
                throw new IOException("device busy");
            }
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
    }
}
