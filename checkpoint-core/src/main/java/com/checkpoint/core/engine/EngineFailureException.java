package com.checkpoint.core.engine;

import java.util.List;

/**
 * Combined error of a run in which one or more engines failed.
 *
 * <p>The findings of the engines that succeeded are still available from
 * {@link Runner#getIssues()}.</p>
 */
public class EngineFailureException extends AnalysisException {

    private final List<EngineFailure> failures;

    public EngineFailureException(List<EngineFailure> failures) {
        super(buildMessage(failures));
        this.failures = List.copyOf(failures);
        failures.forEach(f -> addSuppressed(f.cause()));
    }

    /**
     * Returns the individual failures in completion order.
     *
     * @return engine failures
     */
    public List<EngineFailure> getFailures() {
        return failures;
    }

    private static String buildMessage(List<EngineFailure> failures) {
        StringBuilder sb = new StringBuilder("analysis engines encountered errors: ");
        for (EngineFailure failure : failures) {
            sb.append(failure.describe()).append("; ");
        }
        return sb.toString();
    }
}
