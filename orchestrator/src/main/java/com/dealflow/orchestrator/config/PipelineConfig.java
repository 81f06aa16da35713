package com.dealflow.orchestrator.config;

import com.dealflow.orchestrator.fallback.FallbackSynthesizer;
import com.dealflow.orchestrator.fragment.FragmentMerger;
import com.dealflow.orchestrator.pipeline.EnrichmentRule;
import com.dealflow.orchestrator.pipeline.PipelineDefinition;
import com.dealflow.orchestrator.pipeline.PipelineSettings;
import com.dealflow.orchestrator.pipeline.ReportSynthesizer;
import com.dealflow.orchestrator.reasoning.GeminiReasoningClient;
import com.dealflow.orchestrator.reasoning.ReasoningClient;
import com.dealflow.orchestrator.reasoning.ReasoningOptions;
import com.dealflow.orchestrator.stage.RetrySettings;
import com.dealflow.orchestrator.stage.StageNames;
import com.dealflow.orchestrator.stage.impl.AnalysisStage;
import com.dealflow.orchestrator.stage.impl.ExtractionStage;
import com.dealflow.orchestrator.stage.impl.RiskStage;
import com.dealflow.orchestrator.stage.impl.ValuationStage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the pipeline core from application.yml.
 *
 * The core classes (runner, merger, synthesizers, orchestrator) carry no Spring
 * annotations; everything framework-specific happens here.
 */
@Configuration
public class PipelineConfig {

    // ------------------------------------------------------------------
    // Pipeline
    // ------------------------------------------------------------------

    @Bean
    public PipelineSettings pipelineSettings(
            @Value("${dealflow.pipeline.max-retries:3}")          int maxRetries,
            @Value("${dealflow.pipeline.stage-timeout:120s}")     Duration stageTimeout,
            @Value("${dealflow.pipeline.backoff-base:1s}")        Duration backoffBase,
            @Value("${dealflow.pipeline.overall-timeout:300s}")   Duration overallTimeout) {
        return new PipelineSettings(new RetrySettings(maxRetries, stageTimeout, backoffBase), overallTimeout);
    }

    /**
     * Shared pool for pipeline bodies, stage tasks and individual attempts.
     * Cached (unbounded) because those tasks block on one another; the number
     * of concurrent runs is capped upstream by AnalysisService's worker pool.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService stageExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = r -> {
            Thread t = new Thread(r, "dealflow-stage-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newCachedThreadPool(threads);
    }

    @Bean
    public FragmentMerger fragmentMerger() {
        return new FragmentMerger();
    }

    @Bean
    public FallbackSynthesizer fallbackSynthesizer() {
        return new FallbackSynthesizer();
    }

    @Bean
    public ReportSynthesizer reportSynthesizer() {
        return new ReportSynthesizer();
    }

    @Bean
    public PipelineDefinition pipelineDefinition(ReasoningClient client,
                                                 ReasoningOptions options,
                                                 FragmentMerger merger) {
        return new PipelineDefinition(
                new ExtractionStage(client, options, merger),
                List.of(
                        new AnalysisStage(client, options),
                        new RiskStage(client, options),
                        new ValuationStage(client, options)),
                new EnrichmentRule(StageNames.VALUATION, StageNames.ANALYSIS));
    }

    // ------------------------------------------------------------------
    // Reasoning service
    // ------------------------------------------------------------------

    @Bean
    public ReasoningOptions reasoningOptions(
            @Value("${dealflow.reasoning.temperature:0.2}") double temperature) {
        return ReasoningOptions.withTemperature(temperature);
    }

    @Bean
    public ReasoningClient reasoningClient(
            @Value("${dealflow.reasoning.base-url:https://generativelanguage.googleapis.com}") String baseUrl,
            @Value("${dealflow.reasoning.api-key}")                                          String apiKey,
            @Value("${dealflow.reasoning.model:gemini-1.5-pro}")                              String model,
            @Value("${dealflow.reasoning.request-timeout:90s}")                               Duration requestTimeout,
            ObjectMapper objectMapper) {
        return new GeminiReasoningClient(baseUrl, apiKey, model, requestTimeout, objectMapper);
    }
}
