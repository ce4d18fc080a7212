package com.checkpoint.core.engine;

/**
 * Hard failure of an analysis engine: the engine could not run at all.
 *
 * <p>Task-level problems are not reported this way; {@link BaseEngine} turns them
 * into findings instead.</p>
 */
public class AnalysisException extends Exception {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
