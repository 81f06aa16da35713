package com.dealflow.orchestrator.stage;

/**
 * What a {@link StageRunner} hands back: either the operation's value or an
 * explicit failure. Retry exhaustion is a value, not an exception, so the
 * caller decides whether to substitute a fallback or abort.
 */
public sealed interface StageOutcome<T> permits StageOutcome.Completed, StageOutcome.Failed {

    default boolean isCompleted() {
        return this instanceof Completed<T>;
    }

    record Completed<T>(T value) implements StageOutcome<T> {}

    /**
     * @param kind            MAX_RETRIES_EXCEEDED, NON_RETRYABLE or CANCELLED
     * @param lastAttemptKind classification of the final failed attempt
     * @param message         last error message
     */
    record Failed<T>(StageErrorKind kind, StageErrorKind lastAttemptKind, String message)
            implements StageOutcome<T> {}
}
