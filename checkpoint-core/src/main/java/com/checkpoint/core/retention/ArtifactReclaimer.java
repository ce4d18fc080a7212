package com.checkpoint.core.retention;

import com.checkpoint.core.util.ByteSizes;
import com.checkpoint.core.util.PathUtils;
import com.checkpoint.core.workspace.Workspace;
import com.checkpoint.core.workspace.WorkspaceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

/**
 * Reclaims disk space from tracked workspaces and from leftover scratch entries.
 *
 * <p>Two sources are reclaimed by {@link #cleanupTemporaryFiles()}:
 * <ol>
 *   <li>Workspaces handed over through {@link #registerWorkspace(Workspace)} that are
 *       disk-backed and not yet disposed.</li>
 *   <li>Entries directly under the base directory (default: the system temp directory)
 *       whose name matches at least one enabled include pattern and no exclude pattern.</li>
 * </ol>
 *
 * <p>In dry-run mode every size computation and counter update still happens, only the
 * removals are skipped, so the result previews the effect of a real cleanup exactly.
 * A failed removal is recorded in {@link CleanupResult#errors()} and does not stop the
 * remaining removals.</p>
 *
 * <p>Not thread-safe. Two processes cleaning the same base directory at the same time
 * are not coordinated.</p>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ArtifactReclaimer reclaimer = new ArtifactReclaimer(false);
 * reclaimer.loadConfig(Path.of(".checkpoint.toml"));
 * if (reclaimer.checkStorageUsage(reclaimer.getConfig().storageThreshold()).needsCleanup()) {
 *     reclaimer.cleanupAndReport();
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class ArtifactReclaimer implements WorkspaceTracker {

    private static final Logger log = LoggerFactory.getLogger(ArtifactReclaimer.class);

    /**
     * Include rules every reclaimer starts with.
     */
    public static final List<CleanupPattern> DEFAULT_PATTERNS = List.of(
        CleanupPattern.of("checkpoint-*", "Checkpoint temporary files"),
        CleanupPattern.of("test-*", "Test temporary files"),
        CleanupPattern.of("*.tmp", "Generic temporary files")
    );

    private final boolean verbose;
    private final StorageUsageProbe usageProbe;
    private final List<CleanupPattern> patterns = new ArrayList<>(DEFAULT_PATTERNS);
    private final List<Workspace> workspaces = new ArrayList<>();
    private CleanupConfig config = CleanupConfig.defaults();
    private Path baseDir = Paths.get(System.getProperty("java.io.tmpdir"));
    private boolean dryRun;

    /**
     * Creates a reclaimer measuring storage through the base directory's file store.
     *
     * @param verbose log every removed item at INFO instead of DEBUG
     */
    public ArtifactReclaimer(boolean verbose) {
        this(verbose, StorageUsageProbe.fileStore());
    }

    /**
     * Creates a reclaimer with a custom storage probe.
     *
     * @param verbose log every removed item at INFO instead of DEBUG
     * @param usageProbe measures storage usage
     */
    public ArtifactReclaimer(boolean verbose, StorageUsageProbe usageProbe) {
        this.verbose = verbose;
        this.usageProbe = Objects.requireNonNull(usageProbe, "usageProbe must not be null");
    }

    @Override
    public void registerWorkspace(Workspace workspace) {
        workspaces.add(Objects.requireNonNull(workspace, "workspace must not be null"));
    }

    /**
     * Returns the number of workspaces awaiting reclamation.
     *
     * @return tracked workspace count
     */
    public int trackedWorkspaces() {
        return workspaces.size();
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    /**
     * Sets the directory whose entries are matched against the patterns.
     *
     * @param baseDir scratch base directory
     */
    public void setBaseDir(Path baseDir) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir must not be null");
    }

    public Path getBaseDir() {
        return baseDir;
    }

    public CleanupConfig getConfig() {
        return config;
    }

    /**
     * Replaces the configuration and appends its enabled custom patterns.
     *
     * @param config configuration to apply
     */
    public void applyConfig(CleanupConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        for (CleanupPattern pattern : config.customPatterns()) {
            if (pattern.enabled()) {
                addCustomPattern(pattern.pattern(), pattern.description());
            }
        }
    }

    /**
     * Loads a TOML configuration file and merges it into this reclaimer.
     * A missing file leaves the defaults untouched.
     *
     * @param configPath TOML file with a {@code [cleanup]} table
     * @throws IOException if the file exists but cannot be decoded
     */
    public void loadConfig(Path configPath) throws IOException {
        CleanupConfigLoader.load(configPath).ifPresent(this::applyConfig);
    }

    /**
     * Adds an enabled include rule.
     *
     * @param pattern glob matched against entry names
     * @param description explanation of the target
     */
    public void addCustomPattern(String pattern, String description) {
        patterns.add(CleanupPattern.of(pattern, description));
    }

    /**
     * Returns the include rules, defaults first.
     *
     * @return copy of the patterns
     */
    public List<CleanupPattern> getPatterns() {
        return List.copyOf(patterns);
    }

    /**
     * Checks the syntax of every include and exclude pattern.
     *
     * @throws IllegalArgumentException naming the first invalid pattern
     */
    public void validatePatterns() {
        for (CleanupPattern pattern : patterns) {
            try {
                matcher(pattern.pattern());
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("invalid pattern \"" + pattern.pattern() + "\": " + e.getDescription(), e);
            }
        }
        for (String exclude : config.excludePatterns()) {
            try {
                matcher(exclude);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("invalid exclude pattern \"" + exclude + "\": " + e.getDescription(), e);
            }
        }
    }

    /**
     * Disposes tracked workspaces and removes matching entries of the base directory.
     *
     * @return counts, bytes freed, usage before and after, and per-item errors
     * @throws IOException if the base directory cannot be listed
     */
    public CleanupResult cleanupTemporaryFiles() throws IOException {
        long start = System.nanoTime();
        CleanupResult.Builder result = new CleanupResult.Builder(dryRun);
        result.storageUsageBefore = storageUsage();

        log.info("Starting temporary file cleanup{}...", dryRun ? " (DRY RUN)" : "");
        log.info("Storage usage before cleanup: {}%", formatPercent(result.storageUsageBefore));

        Set<Path> workspaceRoots = new HashSet<>();
        List<Workspace> undisposed = new ArrayList<>();
        for (Workspace workspace : workspaces) {
            workspace.root().ifPresent(workspaceRoots::add);
            if (!processWorkspace(workspace, result)) {
                undisposed.add(workspace);
            }
        }
        if (!dryRun) {
            // Workspaces that failed to dispose stay tracked for the next run.
            workspaces.retainAll(undisposed);
        }

        List<Path> entries;
        try (Stream<Path> listing = Files.list(baseDir)) {
            entries = listing.toList();
        } catch (IOException e) {
            throw new IOException("failed to read " + baseDir + " directory: " + e.getMessage(), e);
        }
        for (Path entry : entries) {
            if (!workspaceRoots.contains(entry)) {
                processEntry(entry, result);
            }
        }

        result.storageUsageAfter = dryRun ? result.storageUsageBefore : storageUsage();
        CleanupResult done = result.build(Duration.ofNanos(System.nanoTime() - start));
        logResult(done);
        return done;
    }

    /**
     * Runs a dry-run cleanup and restores the previous mode afterwards.
     *
     * @return what a real cleanup would remove
     * @throws IOException if the base directory cannot be listed
     */
    public CleanupResult previewCleanup() throws IOException {
        boolean previous = dryRun;
        dryRun = true;
        try {
            return cleanupTemporaryFiles();
        } finally {
            dryRun = previous;
        }
    }

    /**
     * Runs cleanup and always logs a summary, including every error message.
     * Intended for the end of a command or for error paths.
     *
     * @return cleanup result
     * @throws IOException if the base directory cannot be listed
     */
    public CleanupResult cleanupAndReport() throws IOException {
        CleanupResult result = cleanupTemporaryFiles();
        if (result.dryRun()) {
            log.info("=== Cleanup Preview (DRY RUN) === files: {}, directories: {}, estimated space freed: {}",
                result.filesRemoved(), result.dirsRemoved(), ByteSizes.format(result.spaceFreed()));
        } else {
            log.info("=== Cleanup Summary === files: {}, directories: {}, space freed: {}, storage usage: {}% -> {}%",
                result.filesRemoved(), result.dirsRemoved(), ByteSizes.format(result.spaceFreed()),
                formatPercent(result.storageUsageBefore()), formatPercent(result.storageUsageAfter()));
        }
        for (String error : result.errors()) {
            log.warn("  - {}", error);
        }
        return result;
    }

    /**
     * Compares current storage usage against a threshold without removing anything.
     *
     * @param threshold usage percentage
     * @return whether usage is strictly above the threshold, and the usage itself
     */
    public StorageCheck checkStorageUsage(double threshold) {
        double usage = storageUsage();
        return new StorageCheck(usage > threshold, usage);
    }

    /**
     * Decides whether an entry name is a cleanup target.
     *
     * @param name entry file name
     * @return true if an enabled include pattern matches and no exclude pattern does
     */
    boolean shouldClean(String name) {
        Path candidate = Paths.get(name);
        boolean included = patterns.stream()
            .filter(CleanupPattern::enabled)
            .anyMatch(p -> safeMatches(p.pattern(), candidate));
        if (!included) {
            return false;
        }
        return config.excludePatterns().stream().noneMatch(exclude -> safeMatches(exclude, candidate));
    }

    /**
     * Disposes one tracked disk workspace, or counts it in a dry run.
     *
     * @return false if the workspace could not be disposed
     */
    private boolean processWorkspace(Workspace workspace, CleanupResult.Builder result) {
        Path root = workspace.root().orElse(null);
        if (root == null || workspace.isDisposed()) {
            return true;
        }

        try {
            result.spaceFreed += PathUtils.sizeOf(root);
        } catch (IOException e) {
            log.debug("Could not size workspace {}: {}", root, e.getMessage());
        }

        logItem(dryRun ? "Would remove workspace: {}" : "Removing workspace: {}", root);

        if (dryRun) {
            result.dirsRemoved++;
            return true;
        }
        try {
            workspace.cleanup();
            result.dirsRemoved++;
            return true;
        } catch (IOException e) {
            result.errors.add("Failed to cleanup workspace " + root + ": " + e.getMessage());
            return false;
        }
    }

    private void processEntry(Path entry, CleanupResult.Builder result) {
        Path fileName = entry.getFileName();
        if (fileName == null || !shouldClean(fileName.toString())) {
            return;
        }

        boolean directory = Files.isDirectory(entry);
        try {
            result.spaceFreed += PathUtils.sizeOf(entry);
        } catch (IOException e) {
            log.debug("Could not size {}: {}", entry, e.getMessage());
        }

        logItem(dryRun ? "Would remove: {}" : "Removing: {}", entry);

        if (!dryRun) {
            try {
                PathUtils.deleteRecursively(entry);
            } catch (IOException e) {
                result.errors.add("Failed to remove " + entry + ": " + e.getMessage());
                return;
            }
        }
        if (directory) {
            result.dirsRemoved++;
        } else {
            result.filesRemoved++;
        }
    }

    private double storageUsage() {
        try {
            return usageProbe.usagePercent(baseDir);
        } catch (IOException e) {
            log.debug("Could not measure storage usage of {}: {}", baseDir, e.getMessage());
            return 0.0;
        }
    }

    private void logItem(String message, Path path) {
        if (verbose) {
            log.info(message, path);
        } else {
            log.debug(message, path);
        }
    }

    private void logResult(CleanupResult result) {
        log.info("Cleanup completed in {} ms", result.duration().toMillis());
        if (result.dryRun()) {
            log.info("Files that would be removed: {}, Directories that would be removed: {}",
                result.filesRemoved(), result.dirsRemoved());
            log.info("Estimated space freed: {}", ByteSizes.format(result.spaceFreed()));
        } else {
            log.info("Files removed: {}, Directories removed: {}", result.filesRemoved(), result.dirsRemoved());
            log.info("Space freed: {}", ByteSizes.format(result.spaceFreed()));
            log.info("Storage usage after cleanup: {}%", formatPercent(result.storageUsageAfter()));
        }
        if (result.hasErrors()) {
            log.warn("Errors encountered: {}", result.errors().size());
        }
    }

    private static boolean safeMatches(String glob, Path candidate) {
        try {
            return matcher(glob).matches(candidate);
        } catch (PatternSyntaxException e) {
            return false;
        }
    }

    private static PathMatcher matcher(String glob) {
        return FileSystems.getDefault().getPathMatcher("glob:" + glob);
    }

    private static String formatPercent(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
