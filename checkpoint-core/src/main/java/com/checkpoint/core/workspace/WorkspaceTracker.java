package com.checkpoint.core.workspace;

/**
 * Takes over disposal responsibility for workspaces handed to it.
 *
 * <p>After registration only the tracker may dispose the workspace for good;
 * the creator may still call {@link Workspace#cleanup()} because disposal is
 * idempotent.</p>
 */
public interface WorkspaceTracker {

    /**
     * Starts tracking a workspace.
     *
     * @param workspace workspace to track
     */
    void registerWorkspace(Workspace workspace);
}
