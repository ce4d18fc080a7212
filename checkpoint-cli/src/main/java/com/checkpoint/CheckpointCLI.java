package com.checkpoint;

import com.checkpoint.cli.ArchiveCommand;
import com.checkpoint.cli.AuditCommand;
import com.checkpoint.cli.CleanupCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for Checkpoint.
 *
 * <p>Checkpoint audits a project's own source tree and manages the artifacts
 * produced by its runs.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code audit} - Run the analysis engines and print findings</li>
 *   <li>{@code cleanup} - Reclaim temporary files and workspaces</li>
 *   <li>{@code archive} - Snapshot, rotate and prune audit artifacts</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Audit the current directory and save a snapshot of the findings
 * checkpoint audit --save
 *
 * # Preview temporary-file cleanup
 * checkpoint -v cleanup --dry-run
 *
 * # Keep five active snapshots
 * checkpoint archive rotate --max-active 5
 * }</pre>
 */
@Command(
    name = "checkpoint",
    mixinStandardHelpOptions = true,
    version = "Checkpoint 1.0.0-SNAPSHOT",
    description = "Self-audit pipeline for project source trees",
    subcommands = {
        AuditCommand.class,
        CleanupCommand.class,
        ArchiveCommand.class
    }
)
public class CheckpointCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CheckpointCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("Checkpoint - Self-audit pipeline");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'checkpoint --help' to see available commands");
        System.out.println("Use 'checkpoint <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line, applying the global logging options before any
     * command runs.
     *
     * @return configured command line
     */
    public static CommandLine newCommandLine() {
        CheckpointCLI cli = new CheckpointCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }
}
