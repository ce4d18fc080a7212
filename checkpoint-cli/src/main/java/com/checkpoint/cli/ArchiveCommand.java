package com.checkpoint.cli;

import com.checkpoint.core.config.AuditConfig;
import com.checkpoint.core.config.ConfigLoader;
import com.checkpoint.core.model.SnapshotInfo;
import com.checkpoint.core.retention.Archivist;
import com.checkpoint.core.util.ByteSizes;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command group managing the artifact directory: snapshots of the latest
 * findings, rotation of old snapshots into monthly archive buckets, and
 * pruning of expired buckets.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * checkpoint archive snapshot release-1.2
 * checkpoint archive rotate --max-active 5
 * checkpoint archive prune --months 6
 * checkpoint archive list
 * checkpoint archive --root build/artifacts list
 * }</pre>
 */
@Command(
    name = "archive",
    description = "Manage audit snapshots and archives",
    mixinStandardHelpOptions = true
)
public class ArchiveCommand implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ArchiveCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"-r", "--root"},
        description = "Artifact root directory (default: from checkpoint.yaml, else checkpoint-artifacts)"
    )
    private Path artifactRoot;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: checkpoint.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Command(name = "snapshot", description = "Copy the latest findings into a new snapshot")
    int snapshot(@Parameters(arity = "0..1", paramLabel = "NAME",
                             description = "Snapshot name (default: snapshot_<timestamp>)") String name) {
        try {
            Path snapshot = archivist().createSnapshot(name != null ? name : "");
            System.out.println("✓ Created snapshot: " + snapshot.getFileName());
            return 0;
        } catch (IOException e) {
            return fail("Snapshot failed", e);
        }
    }

    @Command(name = "rotate", description = "Move the oldest snapshots into monthly archive buckets")
    int rotate(@Option(names = "--max-active", description = "Snapshots to keep active (default: from config)")
               Integer maxActive) {
        int keep = maxActive != null ? maxActive : config().retention().maxActiveSnapshots();
        try {
            List<String> archived = archivist().archiveOldSnapshots(keep);
            System.out.println("✓ Archived " + archived.size() + " snapshots");
            archived.forEach(snapshot -> System.out.println("  - " + snapshot));
            return 0;
        } catch (IOException | IllegalArgumentException e) {
            return fail("Rotation failed", e);
        }
    }

    @Command(name = "prune", description = "Delete archive buckets older than the retention period")
    int prune(@Option(names = "--months", description = "Months to keep (default: from config)")
              Integer months) {
        int retention = months != null ? months : config().retention().archiveRetentionMonths();
        try {
            List<String> removed = archivist().cleanupArchives(retention);
            System.out.println("✓ Removed " + removed.size() + " archive buckets");
            removed.forEach(bucket -> System.out.println("  - " + bucket));
            return 0;
        } catch (IOException e) {
            return fail("Pruning failed", e);
        }
    }

    @Command(name = "list", description = "List active snapshots, oldest first")
    int list() {
        try {
            List<SnapshotInfo> snapshots = archivist().getActiveSnapshots();
            if (snapshots.isEmpty()) {
                System.out.println("No active snapshots");
            }
            for (SnapshotInfo info : snapshots) {
                System.out.println(info.name() + "  " + info.timestamp() + "  " + ByteSizes.format(info.size()));
            }
            return 0;
        } catch (IOException e) {
            return fail("Listing failed", e);
        }
    }

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    private Archivist archivist() {
        Path root = artifactRoot != null ? artifactRoot : Paths.get(config().retention().artifactRoot());
        log.debug("Using artifact root: {}", root.toAbsolutePath());
        return new Archivist(root);
    }

    private AuditConfig config() {
        return ConfigLoader.load(configPath);
    }

    private static int fail(String message, Exception e) {
        log.error(message, e);
        System.err.println("✗ " + message + ": " + e.getMessage());
        return 1;
    }
}
