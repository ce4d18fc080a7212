package com.checkpoint.cli;

import com.checkpoint.CheckpointCLI;
import com.checkpoint.core.retention.ArtifactReclaimer;
import com.checkpoint.core.retention.CleanupPattern;
import com.checkpoint.core.retention.CleanupResult;
import com.checkpoint.core.retention.StorageCheck;
import com.checkpoint.core.util.ByteSizes;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to reclaim temporary files left behind by audits and tests.
 *
 * <p>Cleanup only runs when storage usage is above the threshold, unless
 * {@code --force} is given. {@code --dry-run} lists what would be removed.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Preview
 * checkpoint cleanup --dry-run
 *
 * # Clean a custom directory regardless of usage
 * checkpoint cleanup --base-dir /var/tmp --force
 * }</pre>
 */
@Command(
    name = "cleanup",
    description = "Remove temporary files and directories matching the cleanup patterns",
    mixinStandardHelpOptions = true
)
public class CleanupCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CleanupCommand.class);

    @ParentCommand
    private CheckpointCLI parent;

    @Option(
        names = {"--dry-run"},
        description = "Show what would be cleaned without removing anything"
    )
    private boolean dryRun;

    @Option(
        names = {"--force"},
        description = "Clean even if storage usage is below the threshold"
    )
    private boolean force;

    @Option(
        names = {"--threshold"},
        description = "Storage usage percentage that triggers cleanup (default: from config, else 80)"
    )
    private Double threshold;

    @Option(
        names = {"--base-dir"},
        description = "Directory to clean (default: system temporary directory)"
    )
    private Path baseDir;

    @Option(
        names = {"-c", "--config"},
        description = "Cleanup configuration file (default: .checkpoint.toml)"
    )
    private Path configPath = Paths.get(".checkpoint.toml");

    @Override
    public Integer call() {
        ArtifactReclaimer reclaimer = new ArtifactReclaimer(parent != null && parent.isVerbose());
        try {
            reclaimer.loadConfig(configPath);
            reclaimer.validatePatterns();
        } catch (IOException | IllegalArgumentException e) {
            log.error("Invalid cleanup configuration", e);
            System.err.println("✗ Invalid cleanup configuration: " + e.getMessage());
            return 2;
        }
        if (baseDir != null) {
            reclaimer.setBaseDir(baseDir);
        }
        reclaimer.setDryRun(dryRun);

        double effectiveThreshold = threshold != null ? threshold : reclaimer.getConfig().storageThreshold();
        StorageCheck check = reclaimer.checkStorageUsage(effectiveThreshold);
        System.out.printf(Locale.ROOT, "Current storage usage: %.1f%%%n", check.usagePercent());

        if (!check.needsCleanup() && !force && !dryRun) {
            System.out.printf(Locale.ROOT,
                "Storage usage (%.1f%%) is below threshold (%.1f%%). Use --force to clean anyway.%n",
                check.usagePercent(), effectiveThreshold);
            return 0;
        }

        if (dryRun) {
            printDryRunInfo(reclaimer);
        } else if (check.needsCleanup()) {
            System.out.printf(Locale.ROOT, "Storage usage (%.1f%%) exceeds threshold (%.1f%%). Starting cleanup...%n",
                check.usagePercent(), effectiveThreshold);
        } else {
            System.out.println("Force cleanup requested...");
        }

        try {
            CleanupResult result = reclaimer.cleanupAndReport();
            printResult(result);
            return result.hasErrors() ? 1 : 0;
        } catch (IOException e) {
            log.error("Cleanup failed", e);
            System.err.println("✗ Cleanup failed: " + e.getMessage());
            return 1;
        }
    }

    private void printDryRunInfo(ArtifactReclaimer reclaimer) {
        System.out.println("DRY RUN MODE - No files will be removed");
        System.out.println("Base directory: " + reclaimer.getBaseDir());
        System.out.println("Would clean:");
        for (CleanupPattern pattern : reclaimer.getPatterns()) {
            if (pattern.enabled()) {
                System.out.println("  - " + reclaimer.getBaseDir().resolve(pattern.pattern())
                    + " (" + pattern.description() + ")");
            }
        }
    }

    private void printResult(CleanupResult result) {
        String verb = result.dryRun() ? "Would remove" : "Removed";
        System.out.printf(Locale.ROOT, "%s %d files and %d directories (%s)%n",
            verb, result.filesRemoved(), result.dirsRemoved(), ByteSizes.format(result.spaceFreed()));
        for (String error : result.errors()) {
            System.err.println("  ✗ " + error);
        }
        if (!result.dryRun()) {
            System.out.println(result.hasErrors() ? "Cleanup completed with errors" : "✓ Cleanup completed successfully");
        }
    }
}
