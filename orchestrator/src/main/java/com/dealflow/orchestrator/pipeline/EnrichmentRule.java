package com.dealflow.orchestrator.pipeline;

/**
 * After fan-out, if {@code target} failed and {@code source} succeeded for real,
 * run {@code target} once more with {@code source}'s result as extra input.
 */
public record EnrichmentRule(String target, String source) {}
