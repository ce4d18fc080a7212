package com.checkpoint.core.engine;

import com.checkpoint.core.model.Issue;
import com.checkpoint.core.workspace.Workspace;

import java.nio.file.Path;
import java.util.List;

/**
 * One independent unit of work inside a {@link BaseEngine}.
 */
@FunctionalInterface
public interface AnalysisTask {

    List<Issue> run(AnalysisContext context, Path rootPath, Workspace workspace) throws Exception;
}
