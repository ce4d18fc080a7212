package com.checkpoint.core.engine;

import com.checkpoint.core.model.Issue;
import com.checkpoint.core.workspace.Workspace;

import java.nio.file.Path;
import java.util.List;

/**
 * Contract of every pluggable analysis unit scheduled by the {@link Runner}.
 *
 * <p>Engines run concurrently against the same root path and the same
 * {@link Workspace}. They must not share mutable state with each other; the
 * runner's collector is the only synchronization point.</p>
 *
 * @see BaseEngine
 * @since 1.0.0
 */
public interface AnalysisEngine {

    /**
     * Returns the stable name of this engine, used in logs and error messages.
     *
     * @return engine name
     */
    String name();

    /**
     * Analyzes the project below {@code rootPath}.
     *
     * @param context cancellation and deadline signal
     * @param rootPath project root directory
     * @param workspace shared scratch storage for this run
     * @return findings, never null
     * @throws AnalysisException if the engine cannot run at all
     */
    List<Issue> analyze(AnalysisContext context, Path rootPath, Workspace workspace) throws AnalysisException;
}
