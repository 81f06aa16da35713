package com.dealflow.orchestrator.store;

import com.dealflow.orchestrator.model.AnalysisJob;
import com.dealflow.orchestrator.model.AnalysisState;
import com.dealflow.orchestrator.model.CompositeReport;
import com.dealflow.orchestrator.model.ProgressSnapshot;
import com.dealflow.orchestrator.repository.AnalysisJobRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link AnalysisJobStore} backed by the analysis_jobs table.
 *
 * Progress snapshots and reports are stored as JSON text written with the
 * application's ObjectMapper.
 */
@Component
public class JpaAnalysisJobStore implements AnalysisJobStore {

    private static final Logger log = LoggerFactory.getLogger(JpaAnalysisJobStore.class);

    private final AnalysisJobRepository repo;
    private final ObjectMapper          json;

    public JpaAnalysisJobStore(AnalysisJobRepository repo, ObjectMapper objectMapper) {
        this.repo = repo;
        this.json = objectMapper;
    }

    @Override
    @Transactional
    public AnalysisJob create(String companyNameHint) {
        return repo.save(new AnalysisJob(companyNameHint));
    }

    @Override
    public Optional<AnalysisJob> find(UUID id) {
        return repo.findById(id);
    }

    @Override
    @Transactional
    public void markRunning(UUID id) {
        AnalysisJob job = load(id);
        job.setState(AnalysisState.RUNNING);
        repo.save(job);
    }

    @Override
    @Transactional
    public void recordProgress(UUID id, ProgressSnapshot snapshot) {
        AnalysisJob job = load(id);
        job.setCurrentPhase(snapshot.phase());
        job.setProgressPercentage(snapshot.percentage());
        job.setProgressJson(write(snapshot));
        repo.save(job);
    }

    @Override
    @Transactional
    public void complete(UUID id, CompositeReport report) {
        AnalysisJob job = load(id);
        job.setState(AnalysisState.COMPLETED);
        job.setProgressPercentage(100.0);
        job.setReportJson(write(report));
        repo.save(job);
        log.info("Analysis {} COMPLETED ({})", id, report.companyName());
    }

    @Override
    @Transactional
    public void fail(UUID id, String errorCode, String errorMessage) {
        AnalysisJob job = load(id);
        job.setState(AnalysisState.FAILED);
        job.setErrorCode(errorCode);
        job.setErrorMessage(errorMessage);
        repo.save(job);
        log.warn("Analysis {} FAILED [{}]: {}", id, errorCode, errorMessage);
    }

    @Override
    @Transactional
    public int failInterrupted(String errorMessage) {
        List<AnalysisJob> stale = repo.findByStateOrderByCreatedAtAsc(AnalysisState.RUNNING);
        for (AnalysisJob job : stale) {
            job.setState(AnalysisState.FAILED);
            job.setErrorCode("UNEXPECTED");
            job.setErrorMessage(errorMessage);
            repo.save(job);
        }
        return stale.size();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private AnalysisJob load(UUID id) {
        return repo.findById(id).orElseThrow(() ->
                new IllegalStateException("Analysis job not found: " + id));
    }

    private String write(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise " + value.getClass().getSimpleName(), e);
        }
    }
}
