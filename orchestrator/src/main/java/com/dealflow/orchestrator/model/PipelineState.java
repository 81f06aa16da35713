package com.dealflow.orchestrator.model;

/**
 * Orchestrator lifecycle for one run.
 *
 * IDLE → RUNNING_FOUNDATIONAL → RUNNING_FAN_OUT → SYNTHESIZING → DONE
 * ABORTED is terminal: foundational failure, or the outer deadline from any state.
 */
public enum PipelineState {
    IDLE,
    RUNNING_FOUNDATIONAL,
    RUNNING_FAN_OUT,
    SYNTHESIZING,
    DONE,
    ABORTED
}
