package com.dealflow.orchestrator.reasoning;

/**
 * Failure talking to the reasoning service.
 *
 * RATE_LIMITED and TRANSIENT are worth another attempt; PERMANENT (bad request,
 * rejected key) is not.
 */
public class ReasoningException extends RuntimeException {

    public enum Kind { RATE_LIMITED, TRANSIENT, PERMANENT }

    private final Kind kind;
    private final int  statusCode;

    public ReasoningException(Kind kind, int statusCode, String message) {
        super("[" + kind + "] " + message);
        this.kind       = kind;
        this.statusCode = statusCode;
    }

    public ReasoningException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind       = kind;
        this.statusCode = -1;
    }

    public Kind getKind()       { return kind; }

    /** HTTP status of the failed call, or -1 when no response was received. */
    public int  getStatusCode() { return statusCode; }

    public boolean isRetryable() { return kind != Kind.PERMANENT; }
}
