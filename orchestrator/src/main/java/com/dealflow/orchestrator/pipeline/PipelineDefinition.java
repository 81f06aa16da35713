package com.dealflow.orchestrator.pipeline;

import com.dealflow.orchestrator.stage.FanOutStage;
import com.dealflow.orchestrator.stage.FoundationalStage;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Which stages make up a pipeline. Fan-out stage names must be unique and must
 * differ from the foundational stage's name.
 */
public record PipelineDefinition(
        FoundationalStage foundational,
        List<FanOutStage> fanOut,
        EnrichmentRule    enrichment
) {
    public PipelineDefinition {
        fanOut = List.copyOf(fanOut);
        Set<String> names = new HashSet<>();
        names.add(foundational.name());
        for (FanOutStage stage : fanOut) {
            if (!names.add(stage.name())) {
                throw new IllegalArgumentException("Duplicate stage name: " + stage.name());
            }
        }
    }

    public Optional<EnrichmentRule> enrichmentRule() {
        return Optional.ofNullable(enrichment);
    }
}
