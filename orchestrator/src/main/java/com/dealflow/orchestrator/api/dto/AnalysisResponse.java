package com.dealflow.orchestrator.api.dto;

import com.dealflow.orchestrator.model.AnalysisJob;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /analyses and GET /analyses/{id}.
 */
public record AnalysisResponse(
        UUID    id,
        String  state,
        String  companyNameHint,
        String  currentPhase,
        double  progressPercentage,
        String  errorCode,
        String  errorMessage,
        Instant createdAt,
        Instant updatedAt
) {
    public static AnalysisResponse from(AnalysisJob job) {
        return new AnalysisResponse(
                job.getId(),
                job.getState().name(),
                job.getCompanyNameHint(),
                job.getCurrentPhase(),
                job.getProgressPercentage(),
                job.getErrorCode(),
                job.getErrorMessage(),
                job.getCreatedAt(),
                job.getUpdatedAt()
        );
    }
}
