package com.dealflow.orchestrator.pipeline;

import com.dealflow.orchestrator.stage.RetrySettings;

import java.time.Duration;

/**
 * @param stageRetry     budget applied to every stage runner
 * @param overallTimeout default outer deadline for one run
 */
public record PipelineSettings(RetrySettings stageRetry, Duration overallTimeout) {}
