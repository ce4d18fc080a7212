package com.checkpoint.core.engine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation and deadline signal threaded through every engine of a run.
 *
 * <p>Engines are expected to call {@link #throwIfDone()} inside long loops.
 * Nothing preempts an engine that ignores the signal.</p>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AnalysisContext context = AnalysisContext.withTimeout(Duration.ofMinutes(5));
 * runner.run(context, projectRoot);
 * }</pre>
 */
public final class AnalysisContext {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Instant deadline;
    private final Clock clock;

    private AnalysisContext(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    /**
     * Creates a context without a deadline.
     *
     * @return cancellable context
     */
    public static AnalysisContext background() {
        return new AnalysisContext(null, Clock.systemUTC());
    }

    /**
     * Creates a context that expires after the given duration.
     *
     * @param timeout time until the deadline
     * @return cancellable context with deadline
     */
    public static AnalysisContext withTimeout(Duration timeout) {
        return withDeadline(Instant.now().plus(timeout), Clock.systemUTC());
    }

    /**
     * Creates a context that expires at the given instant of the given clock.
     *
     * @param deadline expiry instant
     * @param clock clock used to read the current time
     * @return cancellable context with deadline
     */
    public static AnalysisContext withDeadline(Instant deadline, Clock clock) {
        return new AnalysisContext(deadline, clock);
    }

    /**
     * Signals every engine of the run to stop.
     */
    public void cancel() {
        cancelled.set(true);
    }

    /**
     * Returns true once cancelled or past the deadline.
     *
     * @return whether engines should stop
     */
    public boolean isDone() {
        return cancelled.get() || (deadline != null && !clock.instant().isBefore(deadline));
    }

    /**
     * Throws if the run has been cancelled or has expired.
     *
     * @throws CancellationException if {@link #isDone()} is true
     */
    public void throwIfDone() {
        if (cancelled.get()) {
            throw new CancellationException("analysis cancelled");
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            throw new CancellationException("analysis deadline exceeded");
        }
    }
}
