package com.dealflow.orchestrator.model;

/**
 * Lifecycle of a persisted analysis job.
 *
 * QUEUED → RUNNING → COMPLETED | FAILED
 */
public enum AnalysisState {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
