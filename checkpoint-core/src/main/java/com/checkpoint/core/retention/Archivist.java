package com.checkpoint.core.retention;

import com.checkpoint.core.model.SnapshotInfo;
import com.checkpoint.core.model.SnapshotStatus;
import com.checkpoint.core.util.PathUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Generational rotation of audit report snapshots.
 *
 * <p>Sole owner of the active-to-archive transition of snapshots laid out by
 * {@link ArtifactLayout}. Snapshot names are time-ordered strings, so lexicographic
 * order is chronological order. Snapshot creation copies {@code latest} and leaves
 * it in place.</p>
 *
 * <p>Not thread-safe, and not coordinated across processes.</p>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Archivist archivist = new Archivist(Path.of("checkpoint-artifacts"));
 * archivist.createSnapshot("");
 * archivist.archiveOldSnapshots(10);
 * archivist.cleanupArchives(6);
 * }</pre>
 *
 * @since 1.0.0
 */
public class Archivist implements SnapshotOrganizer {

    private static final Logger log = LoggerFactory.getLogger(Archivist.class);

    static final DateTimeFormatter SNAPSHOT_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");
    static final DateTimeFormatter BUCKET_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM")
        .withResolverStyle(ResolverStyle.STRICT);

    private final ArtifactLayout layout;
    private final Clock clock;

    public Archivist(Path rootDir) {
        this(rootDir, Clock.systemDefaultZone());
    }

    public Archivist(Path rootDir, Clock clock) {
        this.layout = new ArtifactLayout(rootDir);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public ArtifactLayout getLayout() {
        return layout;
    }

    @Override
    public Path createSnapshot(String name) throws IOException {
        Path latestDir = layout.latestDir();
        Path snapshotsDir = layout.snapshotsDir().toAbsolutePath().normalize();

        if (name == null || name.isEmpty()) {
            name = "snapshot_" + LocalDateTime.now(clock).format(SNAPSHOT_TIMESTAMP);
        }

        String cleanName = baseName(name);
        Path snapshotDir = snapshotsDir.resolve(cleanName).normalize();
        if (cleanName.isEmpty() || ".".equals(cleanName) || "..".equals(cleanName)
            || !snapshotsDir.equals(snapshotDir.getParent())) {
            throw new IOException("invalid snapshot name: " + name);
        }

        if (!Files.isDirectory(latestDir)) {
            throw new NoSuchFileException(latestDir.toString(), null,
                "cannot create snapshot: latest findings directory missing");
        }
        List<Path> entries;
        try (Stream<Path> listing = Files.list(latestDir)) {
            entries = listing.sorted().toList();
        }
        if (entries.isEmpty()) {
            throw new IOException("cannot create snapshot: latest findings directory is empty");
        }

        Files.createDirectories(snapshotDir);
        for (Path entry : entries) {
            PathUtils.copyRecursively(entry, snapshotDir.resolve(entry.getFileName().toString()));
        }
        log.info("Created snapshot {} with {} entries", cleanName, entries.size());
        return snapshotDir;
    }

    @Override
    public List<String> archiveOldSnapshots(int maxActive) throws IOException {
        if (maxActive < 0) {
            throw new IllegalArgumentException("maxActive must not be negative: " + maxActive);
        }
        Path snapshotsDir = layout.snapshotsDir();
        if (!Files.isDirectory(snapshotsDir)) {
            return List.of();
        }

        List<Path> snapshots = listDirectories(snapshotsDir);
        if (snapshots.size() <= maxActive) {
            return List.of();
        }

        snapshots.sort(Comparator.comparing(p -> p.getFileName().toString()));
        List<Path> toArchive = snapshots.subList(0, snapshots.size() - maxActive);

        Path bucket = layout.archiveDir().resolve(YearMonth.now(clock).format(BUCKET_FORMAT));
        Files.createDirectories(bucket);

        List<String> archived = new ArrayList<>();
        for (Path snapshot : toArchive) {
            String name = snapshot.getFileName().toString();
            Files.move(snapshot, bucket.resolve(name));
            archived.add(name);
        }
        log.info("Archived {} snapshots to {}", archived.size(), bucket);
        return archived;
    }

    @Override
    public List<String> cleanupArchives(int retentionMonths) throws IOException {
        Path archiveDir = layout.archiveDir();
        if (!Files.isDirectory(archiveDir)) {
            return List.of();
        }

        LocalDateTime cutoff = LocalDateTime.now(clock).minusMonths(retentionMonths);
        List<String> removed = new ArrayList<>();

        for (Path bucket : listDirectories(archiveDir)) {
            String name = bucket.getFileName().toString();
            YearMonth month;
            try {
                month = YearMonth.parse(name, BUCKET_FORMAT);
            } catch (DateTimeParseException e) {
                log.debug("Skipping archive entry with unrecognized name: {}", name);
                continue;
            }

            if (month.atDay(1).atStartOfDay().isBefore(cutoff)) {
                try {
                    PathUtils.deleteRecursively(bucket);
                    removed.add(name);
                } catch (IOException e) {
                    log.warn("Failed to remove archive bucket {}: {}", bucket, e.getMessage());
                }
            }
        }
        if (!removed.isEmpty()) {
            log.info("Removed {} archive buckets older than {} months", removed.size(), retentionMonths);
        }
        return removed;
    }

    @Override
    public List<SnapshotInfo> getActiveSnapshots() throws IOException {
        Path snapshotsDir = layout.snapshotsDir();
        if (!Files.isDirectory(snapshotsDir)) {
            return List.of();
        }

        List<SnapshotInfo> infos = new ArrayList<>();
        for (Path dir : listDirectories(snapshotsDir)) {
            try {
                infos.add(new SnapshotInfo(
                    dir.getFileName().toString(),
                    Files.getLastModifiedTime(dir).toInstant(),
                    PathUtils.sizeOf(dir),
                    SnapshotStatus.ACTIVE,
                    dir.toAbsolutePath()
                ));
            } catch (IOException e) {
                log.debug("Skipping unreadable snapshot {}: {}", dir, e.getMessage());
            }
        }
        infos.sort(Comparator.comparing(SnapshotInfo::timestamp).thenComparing(SnapshotInfo::name));
        return infos;
    }

    private static List<Path> listDirectories(Path dir) throws IOException {
        try (Stream<Path> listing = Files.list(dir)) {
            return new ArrayList<>(listing.filter(Files::isDirectory).toList());
        }
    }

    private static String baseName(String name) {
        String trimmed = name.replaceAll("[/\\\\]+$", "");
        int separator = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        return separator >= 0 ? trimmed.substring(separator + 1) : trimmed;
    }
}
