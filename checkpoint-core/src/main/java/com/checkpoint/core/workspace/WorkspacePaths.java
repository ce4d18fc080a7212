package com.checkpoint.core.workspace;

import java.nio.file.Paths;
import java.util.regex.Pattern;

/**
 * Relative-path checks shared by both workspace backends.
 */
final class WorkspacePaths {

    private static final Pattern SEPARATORS = Pattern.compile("[/\\\\]");

    private WorkspacePaths() {
        // Utility class
    }

    /**
     * Rejects absolute paths and any relative path with a parent-directory segment.
     *
     * @param relativePath path to check
     * @return the same path
     * @throws PathTraversalException if the path is absolute or a {@code ..} segment is present
     */
    static String requireContained(String relativePath) throws PathTraversalException {
        if (relativePath == null) {
            throw new PathTraversalException("null");
        }
        if (relativePath.startsWith("/") || relativePath.startsWith("\\") || Paths.get(relativePath).isAbsolute()) {
            throw new PathTraversalException(relativePath);
        }
        for (String segment : SEPARATORS.split(relativePath)) {
            if ("..".equals(segment)) {
                throw new PathTraversalException(relativePath);
            }
        }
        return relativePath;
    }
}
