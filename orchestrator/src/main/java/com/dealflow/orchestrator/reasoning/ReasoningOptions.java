package com.dealflow.orchestrator.reasoning;

/**
 * Per-call generation options. A null model means "the client's configured default".
 */
public record ReasoningOptions(String model, double temperature) {

    public static ReasoningOptions withTemperature(double temperature) {
        return new ReasoningOptions(null, temperature);
    }
}
