package com.checkpoint.core.engine;

import java.util.Objects;

/**
 * Hard failure of a single engine during a run.
 *
 * @param engineName name of the failing engine
 * @param cause what went wrong
 */
public record EngineFailure(String engineName, Throwable cause) {

    public EngineFailure {
        Objects.requireNonNull(engineName, "engineName must not be null");
        Objects.requireNonNull(cause, "cause must not be null");
    }

    /**
     * Returns the single-line form used in the combined error message.
     *
     * @return "engine NAME failed: MESSAGE"
     */
    public String describe() {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return "engine " + engineName + " failed: " + message;
    }
}
