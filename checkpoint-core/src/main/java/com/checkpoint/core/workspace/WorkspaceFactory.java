package com.checkpoint.core.workspace;

import java.io.IOException;

/**
 * Creates the workspace for an analysis run.
 *
 * <p>Passed to the runner explicitly so tests can substitute an in-memory
 * backend or a failing factory.</p>
 */
@FunctionalInterface
public interface WorkspaceFactory {

    /**
     * Creates a new, empty workspace.
     *
     * @return live workspace owned by the caller
     * @throws IOException if the backing storage cannot be created
     */
    Workspace create() throws IOException;
}
