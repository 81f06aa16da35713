package com.dealflow.orchestrator.model;

/**
 * Lifecycle of one stage inside a pipeline run.
 *
 * PENDING → RUNNING → (RETRYING → RUNNING)* → COMPLETED | FAILED
 */
public enum StageState {
    PENDING,
    RUNNING,
    RETRYING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
