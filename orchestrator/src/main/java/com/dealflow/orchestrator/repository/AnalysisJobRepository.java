package com.dealflow.orchestrator.repository;

import com.dealflow.orchestrator.model.AnalysisJob;
import com.dealflow.orchestrator.model.AnalysisState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Spring Data repository for the analysis_jobs table.
 */
public interface AnalysisJobRepository extends JpaRepository<AnalysisJob, UUID> {

    /** Jobs in a given state, oldest first (used to recover interrupted runs on startup). */
    List<AnalysisJob> findByStateOrderByCreatedAtAsc(AnalysisState state);
}
