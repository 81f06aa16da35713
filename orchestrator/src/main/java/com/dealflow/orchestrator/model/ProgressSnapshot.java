package com.dealflow.orchestrator.model;

import java.time.Instant;
import java.util.List;

/**
 * One discrete progress report, emitted at every phase transition.
 *
 * @param estimatedCompletion linear extrapolation from elapsed time and percentage; null at 0%
 */
public record ProgressSnapshot(
        String                phase,
        double                percentage,
        String                message,
        List<ExecutionStatus> stages,
        Instant               startedAt,
        Instant               estimatedCompletion,
        PipelineState         pipelineState
) {
    public ProgressSnapshot {
        stages = List.copyOf(stages);
    }
}
