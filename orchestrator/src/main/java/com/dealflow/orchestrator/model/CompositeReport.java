package com.dealflow.orchestrator.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The final, read-only product of a pipeline run.
 *
 * {@code overallStatus} is always COMPLETED: a report only exists when the run
 * finished, however many stages were degraded to fallbacks on the way.
 */
public record CompositeReport(
        String                   companyName,
        StageResult              foundational,
        Map<String, StageResult> fanOut,
        Synthesis                synthesis,
        List<ExecutionStatus>    stageStatuses,
        StageState               overallStatus,
        Instant                  startedAt,
        Instant                  completedAt,
        double                   processingTimeSeconds
) {
    public CompositeReport {
        fanOut        = Collections.unmodifiableMap(new LinkedHashMap<>(fanOut));
        stageStatuses = List.copyOf(stageStatuses);
    }
}
