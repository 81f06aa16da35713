package com.dealflow.orchestrator.service;

import com.dealflow.orchestrator.model.AnalysisJob;
import com.dealflow.orchestrator.model.CompositeReport;
import com.dealflow.orchestrator.model.PipelineInput;
import com.dealflow.orchestrator.pipeline.PipelineException;
import com.dealflow.orchestrator.pipeline.PipelineOrchestrator;
import com.dealflow.orchestrator.pipeline.PipelineOrchestratorFactory;
import com.dealflow.orchestrator.store.AnalysisJobStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Accepts analysis submissions and runs each one as a pipeline on a fixed
 * worker pool.
 *
 * The pool size caps how many runs talk to the reasoning service at once
 * ({@code dealflow.pipeline.max-concurrent-runs}). Submissions beyond that
 * wait in the pool's queue with state QUEUED.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    static final String ERROR_TIMEOUT    = "PIPELINE_TIMEOUT";
    static final String ERROR_ABORTED    = "PIPELINE_ABORTED";
    static final String ERROR_UNEXPECTED = "UNEXPECTED";

    private final AnalysisJobStore            store;
    private final PipelineOrchestratorFactory orchestrators;
    private final ExecutorService             workers;

    public AnalysisService(AnalysisJobStore store,
                           PipelineOrchestratorFactory orchestrators,
                           @Value("${dealflow.pipeline.max-concurrent-runs:4}") int maxConcurrentRuns) {
        this.store         = store;
        this.orchestrators = orchestrators;
        this.workers       = Executors.newFixedThreadPool(maxConcurrentRuns);
    }

    // ------------------------------------------------------------------
    // Submission and lookup
    // ------------------------------------------------------------------

    public AnalysisJob submit(PipelineInput input) {
        AnalysisJob job = store.create(input.companyNameHint());
        UUID jobId = job.getId();
        log.info("Analysis {} queued ({} pages, hint='{}')",
                jobId, input.pages().size(), input.companyNameHint());

        workers.submit(() -> {
            try {
                runJob(jobId, input);
            } catch (Exception e) {
                log.error("Unhandled error running analysis {}: {}", jobId, e.getMessage(), e);
                store.fail(jobId, ERROR_UNEXPECTED, "Unhandled exception: " + e.getMessage());
            }
        });
        return job;
    }

    public Optional<AnalysisJob> findById(UUID id) {
        return store.find(id);
    }

    // ------------------------------------------------------------------
    // Execution (worker thread)
    // ------------------------------------------------------------------

    /**
     * Runs one job's pipeline to completion and records the outcome. Never
     * throws for pipeline failures; they end up on the job as an error code.
     */
    void runJob(UUID jobId, PipelineInput input) {
        MDC.put("jobId", jobId.toString());
        try {
            store.markRunning(jobId);

            PipelineOrchestrator orchestrator = orchestrators.create();
            MDC.put("runId", orchestrator.runId());
            orchestrator.onProgress(snapshot -> store.recordProgress(jobId, snapshot));

            CompositeReport report = orchestrator.run(input);
            store.complete(jobId, report);

        } catch (PipelineException e) {
            String code = e.getKind() == PipelineException.Kind.TIMEOUT ? ERROR_TIMEOUT : ERROR_ABORTED;
            store.fail(jobId, code, e.getMessage());
        } catch (Exception e) {
            log.error("Analysis {} failed unexpectedly", jobId, e);
            store.fail(jobId, ERROR_UNEXPECTED, String.valueOf(e.getMessage()));
        } finally {
            // Worker threads are pooled; never leak one job's context into the next.
            MDC.clear();
        }
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @EventListener(ApplicationReadyEvent.class)
    public void failInterruptedRuns() {
        int count = store.failInterrupted("Service restarted while the analysis was running");
        if (count > 0) {
            log.warn("Marked {} interrupted analyses as FAILED", count);
        }
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }
}
