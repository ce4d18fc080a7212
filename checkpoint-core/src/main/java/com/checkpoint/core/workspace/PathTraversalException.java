package com.checkpoint.core.workspace;

import java.io.IOException;

/**
 * Thrown when a workspace path tries to escape the workspace root.
 */
public class PathTraversalException extends IOException {

    private final String path;

    public PathTraversalException(String path) {
        super("path traversal not allowed: " + path);
        this.path = path;
    }

    /**
     * Returns the rejected relative path.
     *
     * @return offending path
     */
    public String getPath() {
        return path;
    }
}
