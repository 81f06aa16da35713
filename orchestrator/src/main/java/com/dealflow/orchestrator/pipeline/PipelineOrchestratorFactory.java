package com.dealflow.orchestrator.pipeline;

import com.dealflow.orchestrator.fallback.FallbackSynthesizer;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;

/**
 * Builds a fresh {@link PipelineOrchestrator} for every run. Orchestrators hold
 * per-run state (observers, progress log, stage statuses) and are never reused.
 */
@Component
public class PipelineOrchestratorFactory {

    private final PipelineDefinition  definition;
    private final PipelineSettings    settings;
    private final ExecutorService     stageExecutor;
    private final FallbackSynthesizer fallbacks;
    private final ReportSynthesizer   synthesizer;
    private final MeterRegistry       meterRegistry;

    public PipelineOrchestratorFactory(PipelineDefinition definition,
                                       PipelineSettings settings,
                                       @Qualifier("stageExecutor") ExecutorService stageExecutor,
                                       FallbackSynthesizer fallbacks,
                                       ReportSynthesizer synthesizer,
                                       MeterRegistry meterRegistry) {
        this.definition    = definition;
        this.settings      = settings;
        this.stageExecutor = stageExecutor;
        this.fallbacks     = fallbacks;
        this.synthesizer   = synthesizer;
        this.meterRegistry = meterRegistry;
    }

    public PipelineOrchestrator create() {
        return new PipelineOrchestrator(definition, settings, stageExecutor,
                fallbacks, synthesizer, meterRegistry);
    }

    public PipelineSettings settings() { return settings; }
}
