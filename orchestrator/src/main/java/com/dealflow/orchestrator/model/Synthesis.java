package com.dealflow.orchestrator.model;

import java.util.List;

/**
 * Deterministic conclusions drawn from all stage results.
 *
 * @param degradedStages fan-out stages whose result is a fallback
 */
public record Synthesis(
        Recommendation   finalRecommendation,
        ConfidenceLevel  convictionLevel,
        ExecutiveSummary executiveSummary,
        List<String>     diligenceItems,
        List<String>     keyQuestions,
        List<String>     degradedStages
) {}
