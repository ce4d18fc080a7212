package com.checkpoint.cli;

import com.checkpoint.CheckpointCLI;
import com.checkpoint.core.config.AuditConfig;
import com.checkpoint.core.config.ConfigLoader;
import com.checkpoint.core.engine.AnalysisContext;
import com.checkpoint.core.engine.AnalysisException;
import com.checkpoint.core.engine.EngineFailure;
import com.checkpoint.core.engine.EngineFailureException;
import com.checkpoint.core.engine.Runner;
import com.checkpoint.core.flags.FlagReconciliationEngine;
import com.checkpoint.core.flags.FlagStatusReport;
import com.checkpoint.core.flags.HelpTextRenderer;
import com.checkpoint.core.model.FlagStatus;
import com.checkpoint.core.model.Issue;
import com.checkpoint.core.model.IssueOrdering;
import com.checkpoint.core.retention.Archivist;
import com.checkpoint.core.retention.ArtifactReclaimer;
import com.checkpoint.core.retention.StorageCheck;
import com.checkpoint.core.source.JavaParserSourceModelProvider;
import com.checkpoint.core.workspace.Workspaces;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to audit a project.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Load {@code checkpoint.yaml} and the cleanup configuration</li>
 *   <li>Warn if storage usage is above the cleanup threshold</li>
 *   <li>Run the analysis engines concurrently in one shared workspace</li>
 *   <li>Print the findings, highest priority first</li>
 *   <li>Optionally save the findings and rotate snapshots</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Audit the current directory
 * checkpoint audit
 *
 * # Audit another program, reading its help text from a file
 * checkpoint audit ../tool --help-file ../tool/help.txt
 *
 * # Save findings under checkpoint-artifacts/ and snapshot them
 * checkpoint audit --save
 * }</pre>
 */
@Command(
    name = "audit",
    description = "Audit a project's flags, documentation and implementation",
    mixinStandardHelpOptions = true
)
public class AuditCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AuditCommand.class);

    static final String FINDINGS_FILE = "findings.json";
    static final String FLAG_REPORT_FILE = "findings_flag_report.md";

    @ParentCommand
    private CheckpointCLI parent;

    @Parameters(
        index = "0",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: checkpoint.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"--in-memory"},
        description = "Use an in-memory workspace instead of a temporary directory"
    )
    private boolean inMemory;

    @Option(
        names = {"--timeout"},
        description = "Abort the analysis after this duration (ISO-8601, e.g. PT30S)"
    )
    private Duration timeout;

    @Option(
        names = {"--help-file"},
        description = "Read the audited program's help text from this file (default: this CLI's help)"
    )
    private Path helpFile;

    @Option(
        names = {"--save"},
        description = "Save findings to the artifact directory and snapshot them"
    )
    private boolean save;

    @Override
    public Integer call() {
        Path root = projectPath.toAbsolutePath().normalize();
        log.info("Starting audit of: {}", root);
        System.out.println("Auditing project: " + root);
        System.out.println();

        AuditConfig config = ConfigLoader.load(configPath.isAbsolute() ? configPath : root.resolve(configPath));
        ArtifactReclaimer reclaimer = createReclaimer(root, config);
        warnOnStorageUsage(reclaimer);

        FlagReconciliationEngine flagEngine = new FlagReconciliationEngine(
            config.flags(), new JavaParserSourceModelProvider(), helpTextRenderer());
        Runner runner = new Runner(List.of(flagEngine), Workspaces.factory(inMemory), reclaimer);
        AnalysisContext context = timeout != null ? AnalysisContext.withTimeout(timeout) : AnalysisContext.background();

        int exitCode = 0;
        try {
            runner.run(context, root);
        } catch (EngineFailureException e) {
            exitCode = 1;
            for (EngineFailure failure : e.getFailures()) {
                System.err.println("✗ " + failure.describe());
            }
        } catch (AnalysisException e) {
            log.error("Audit failed", e);
            System.err.println("✗ Audit failed: " + e.getMessage());
            return 1;
        }

        List<Issue> issues = IssueOrdering.sortForReport(runner.getIssues());
        printIssues(issues);

        if (save) {
            try {
                saveFindings(root, config, issues, flagEngine.lastFlags());
            } catch (IOException e) {
                log.error("Failed to save findings", e);
                System.err.println("✗ Failed to save findings: " + e.getMessage());
                return 1;
            }
        }
        return exitCode;
    }

    private ArtifactReclaimer createReclaimer(Path root, AuditConfig config) {
        ArtifactReclaimer reclaimer = new ArtifactReclaimer(parent != null && parent.isVerbose());
        Path cleanupConfig = root.resolve(config.retention().cleanupConfig());
        try {
            reclaimer.loadConfig(cleanupConfig);
        } catch (IOException e) {
            log.warn("Ignoring cleanup configuration {}: {}", cleanupConfig, e.getMessage());
        }
        return reclaimer;
    }

    private void warnOnStorageUsage(ArtifactReclaimer reclaimer) {
        double threshold = reclaimer.getConfig().storageThreshold();
        StorageCheck check = reclaimer.checkStorageUsage(threshold);
        if (check.needsCleanup()) {
            System.out.printf(Locale.ROOT,
                "Warning: Storage usage is %.1f%%. Consider running 'checkpoint cleanup' before analysis.%n",
                check.usagePercent());
        }
    }

    private HelpTextRenderer helpTextRenderer() {
        if (helpFile != null) {
            return () -> Files.readString(helpFile, StandardCharsets.UTF_8);
        }
        return new PicocliHelpTextRenderer(CheckpointCLI::newCommandLine);
    }

    private void printIssues(List<Issue> issues) {
        if (issues.isEmpty()) {
            System.out.println("✓ No findings");
            return;
        }
        System.out.println("Findings (" + issues.size() + "):");
        for (Issue issue : issues) {
            System.out.printf(Locale.ROOT, "  [%s/%s] %s: %s%n",
                issue.priority(), issue.severity(), issue.id(), issue.title());
            if (!issue.location().isEmpty()) {
                System.out.println("      at " + issue.location());
            }
        }
    }

    private void saveFindings(Path root, AuditConfig config, List<Issue> issues, List<FlagStatus> flags)
            throws IOException {
        Archivist archivist = new Archivist(root.resolve(config.retention().artifactRoot()));
        Path latest = archivist.getLayout().latestDir();
        Files.createDirectories(latest);

        ObjectMapper mapper = new ObjectMapper()
            .findAndRegisterModules()
            .enable(SerializationFeature.INDENT_OUTPUT);
        mapper.writeValue(latest.resolve(FINDINGS_FILE).toFile(), issues);
        Files.writeString(latest.resolve(FLAG_REPORT_FILE), FlagStatusReport.render(flags), StandardCharsets.UTF_8);
        System.out.println("✓ Saved findings to: " + latest);

        Path snapshot = archivist.createSnapshot("");
        System.out.println("✓ Created snapshot: " + snapshot.getFileName());
        try {
            List<String> archived = archivist.archiveOldSnapshots(config.retention().maxActiveSnapshots());
            if (!archived.isEmpty()) {
                System.out.println("✓ Archived " + archived.size() + " snapshots");
            }
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Archival failed: {}", e.getMessage());
            System.out.println("Warning: Archival failed: " + e.getMessage());
        }
    }
}
