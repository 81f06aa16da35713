package com.dealflow.orchestrator.model;

import java.util.List;

public record ExecutiveSummary(
        String         companyOverview,
        List<String>   investmentHighlights,
        List<String>   keyConcerns,
        Recommendation recommendation,
        String         recommendationRationale,
        String         valuationSummary,
        List<String>   nextSteps
) {}
