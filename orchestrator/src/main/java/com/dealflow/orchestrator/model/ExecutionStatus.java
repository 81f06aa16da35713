package com.dealflow.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of one stage's execution. Owned and replaced by the
 * {@link com.dealflow.orchestrator.stage.StageRunner} running that stage;
 * everyone else only reads snapshots.
 */
public record ExecutionStatus(
        String     stageName,
        StageState state,
        Instant    startedAt,
        Instant    completedAt,
        int        retryCount,
        String     errorMessage
) {
    public static ExecutionStatus pending(String stageName) {
        return new ExecutionStatus(stageName, StageState.PENDING, null, null, 0, null);
    }

    public ExecutionStatus withState(StageState newState) {
        return new ExecutionStatus(stageName, newState, startedAt, completedAt, retryCount, errorMessage);
    }

    public ExecutionStatus withRetryCount(int count) {
        return new ExecutionStatus(stageName, state, startedAt, completedAt, count, errorMessage);
    }

    public ExecutionStatus completed(Instant at) {
        return new ExecutionStatus(stageName, StageState.COMPLETED, startedAt, at, retryCount, null);
    }

    public ExecutionStatus failed(Instant at, String error) {
        return new ExecutionStatus(stageName, StageState.FAILED, startedAt, at, retryCount, error);
    }

    /** Elapsed seconds from start to completion (or to now while still running); null before start. */
    @JsonProperty("durationSeconds")
    public Double durationSeconds() {
        Duration d = duration();
        return d == null ? null : d.toMillis() / 1000.0;
    }

    public Duration duration() {
        if (startedAt == null) {
            return null;
        }
        Instant end = completedAt != null ? completedAt : Instant.now();
        return Duration.between(startedAt, end);
    }
}
