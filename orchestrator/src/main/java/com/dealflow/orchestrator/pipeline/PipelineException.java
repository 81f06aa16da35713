package com.dealflow.orchestrator.pipeline;

/**
 * The single way a pipeline run fails. Anything short of this means the caller
 * got a complete report, possibly with degraded stages.
 */
public class PipelineException extends RuntimeException {

    public enum Kind {
        /** The outer deadline passed; every running stage was cancelled. */
        TIMEOUT,
        /** The foundational stage failed, or the run broke unexpectedly. */
        ABORTED
    }

    private final Kind kind;

    public PipelineException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public PipelineException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
