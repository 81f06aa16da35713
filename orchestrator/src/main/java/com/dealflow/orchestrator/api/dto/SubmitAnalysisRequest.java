package com.dealflow.orchestrator.api.dto;

import com.dealflow.orchestrator.model.PipelineInput;

import java.util.List;

/**
 * Request body for POST /analyses.
 *
 * Pages are the already-extracted text of each deck page; textContent is the
 * whole deck as one string. At least one of the two must be non-empty.
 */
public record SubmitAnalysisRequest(
        String       companyNameHint,
        List<String> pages,
        String       textContent
) {
    public PipelineInput toInput() {
        return new PipelineInput(companyNameHint, pages, textContent);
    }
}
