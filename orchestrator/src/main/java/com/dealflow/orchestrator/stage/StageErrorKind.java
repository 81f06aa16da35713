package com.dealflow.orchestrator.stage;

/**
 * Why an attempt (or a whole stage) failed.
 *
 * Only {@link #MAX_RETRIES_EXCEEDED}, {@link #NON_RETRYABLE} and {@link #CANCELLED}
 * ever appear as the final kind of a {@link StageOutcome.Failed}; the others
 * describe a single attempt.
 */
public enum StageErrorKind {
    TIMEOUT,
    OPERATION_ERROR,
    UNEXPECTED,
    NON_RETRYABLE,
    MAX_RETRIES_EXCEEDED,
    CANCELLED;

    public boolean isRetryable() {
        return this == TIMEOUT || this == OPERATION_ERROR || this == UNEXPECTED;
    }
}
