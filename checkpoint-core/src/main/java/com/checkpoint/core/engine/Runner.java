package com.checkpoint.core.engine;

import com.checkpoint.core.model.Issue;
import com.checkpoint.core.workspace.Workspace;
import com.checkpoint.core.workspace.WorkspaceFactory;
import com.checkpoint.core.workspace.WorkspaceTracker;
import com.checkpoint.core.workspace.Workspaces;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a set of analysis engines concurrently against one project.
 *
 * <p>Each run creates one workspace through the injected {@link WorkspaceFactory},
 * shares it with every engine, and disposes it when the run ends whatever the
 * outcome. Findings are gathered through an {@link IssueCollector}; engines that
 * throw are reported together in one {@link EngineFailureException} while the
 * findings of the other engines remain available from {@link #getIssues()}.</p>
 *
 * <p>No ordering is guaranteed between engines or between their findings.
 * Sorting is a reporting concern, see {@link com.checkpoint.core.model.IssueOrdering}.</p>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Runner runner = new Runner(List.of(flagEngine), Workspaces::onDisk, reclaimer);
 * try {
 *     runner.run(AnalysisContext.background(), projectRoot);
 * } catch (EngineFailureException e) {
 *     log.error("{}", e.getMessage());
 * }
 * List<Issue> findings = runner.getIssues();
 * }</pre>
 *
 * @since 1.0.0
 */
public class Runner {

    private static final Logger log = LoggerFactory.getLogger(Runner.class);

    private final List<AnalysisEngine> engines;
    private final WorkspaceFactory workspaceFactory;
    private final WorkspaceTracker workspaceTracker;
    private final IssueCollector collector = new IssueCollector();

    /**
     * Creates a runner using disk workspaces and no workspace tracker.
     *
     * @param engines engines to run
     */
    public Runner(List<? extends AnalysisEngine> engines) {
        this(engines, Workspaces::onDisk, null);
    }

    /**
     * Creates a runner.
     *
     * @param engines engines to run
     * @param workspaceFactory creates the per-run workspace
     * @param workspaceTracker receives the workspace for later reclamation, may be null
     */
    public Runner(List<? extends AnalysisEngine> engines, WorkspaceFactory workspaceFactory,
                  WorkspaceTracker workspaceTracker) {
        this.engines = List.copyOf(engines);
        this.workspaceFactory = Objects.requireNonNull(workspaceFactory, "workspaceFactory must not be null");
        this.workspaceTracker = workspaceTracker;
    }

    /**
     * Executes every engine concurrently and waits for all of them.
     *
     * @param context cancellation signal passed to every engine
     * @param rootPath project root directory
     * @throws EngineFailureException if one or more engines failed
     * @throws AnalysisException if the workspace cannot be created or the run is interrupted
     */
    public void run(AnalysisContext context, Path rootPath) throws AnalysisException {
        collector.clear();

        Workspace workspace;
        try {
            workspace = workspaceFactory.create();
        } catch (IOException e) {
            throw new AnalysisException("failed to create workspace: " + e.getMessage(), e);
        }
        if (workspaceTracker != null) {
            workspaceTracker.registerWorkspace(workspace);
        }

        log.info("Running {} engines against: {}", engines.size(), rootPath);
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, engines.size()), new EngineThreadFactory());
        try {
            List<Map.Entry<AnalysisEngine, Future<List<Issue>>>> futures = new ArrayList<>();
            for (AnalysisEngine engine : engines) {
                futures.add(Map.entry(engine, executor.submit(() -> {
                    log.debug("Starting engine: {}", engine.name());
                    List<Issue> issues = engine.analyze(context, rootPath, workspace);
                    if (issues != null) {
                        collector.collect(issues);
                    }
                    log.debug("Engine {} produced {} issues", engine.name(), issues != null ? issues.size() : 0);
                    return issues;
                })));
            }

            List<EngineFailure> failures = new ArrayList<>();
            for (Map.Entry<AnalysisEngine, Future<List<Issue>>> entry : futures) {
                try {
                    entry.getValue().get();
                } catch (ExecutionException e) {
                    String engineName = entry.getKey().name();
                    log.error("Engine {} failed: {}", engineName, e.getCause().getMessage());
                    failures.add(new EngineFailure(engineName, e.getCause()));
                }
            }

            if (!failures.isEmpty()) {
                throw new EngineFailureException(failures);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisException("analysis interrupted", e);
        } finally {
            executor.shutdownNow();
            disposeQuietly(workspace);
        }
    }

    /**
     * Returns the findings of the last run, including those collected before a failure.
     *
     * @return immutable snapshot of the findings
     */
    public List<Issue> getIssues() {
        return collector.issues();
    }

    private void disposeQuietly(Workspace workspace) {
        try {
            workspace.cleanup();
        } catch (IOException e) {
            log.warn("Failed to dispose workspace {}: {}", workspace, e.getMessage());
        }
    }

    private static final class EngineThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "checkpoint-engine-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
