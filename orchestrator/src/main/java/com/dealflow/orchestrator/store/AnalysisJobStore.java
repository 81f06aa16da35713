package com.dealflow.orchestrator.store;

import com.dealflow.orchestrator.model.AnalysisJob;
import com.dealflow.orchestrator.model.CompositeReport;
import com.dealflow.orchestrator.model.ProgressSnapshot;

import java.util.Optional;
import java.util.UUID;

/**
 * Where analysis runs and their results live. Injected wherever it is needed;
 * there is no process-wide job map.
 *
 * One writer per job: only the worker running a job updates it.
 */
public interface AnalysisJobStore {

    AnalysisJob create(String companyNameHint);

    Optional<AnalysisJob> find(UUID id);

    void markRunning(UUID id);

    void recordProgress(UUID id, ProgressSnapshot snapshot);

    void complete(UUID id, CompositeReport report);

    void fail(UUID id, String errorCode, String errorMessage);

    /** Marks every job left RUNNING by a previous process as FAILED; returns how many. */
    int failInterrupted(String errorMessage);
}
