package com.dealflow.orchestrator.stage;

/**
 * Thrown by a stage operation to tell the {@link StageRunner} how to treat a
 * failed attempt.
 *
 * OPERATION_ERROR attempts are retried within the runner's budget.
 * NON_RETRYABLE ends the stage at once (e.g. a rejected API key or an empty
 * document); retrying would only burn time.
 */
public class StageException extends RuntimeException {

    public enum Kind { OPERATION_ERROR, NON_RETRYABLE }

    private final Kind kind;

    public StageException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public StageException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    public static StageException retryable(String message, Throwable cause) {
        return new StageException(Kind.OPERATION_ERROR, message, cause);
    }

    public static StageException permanent(String message, Throwable cause) {
        return new StageException(Kind.NON_RETRYABLE, message, cause);
    }
}
