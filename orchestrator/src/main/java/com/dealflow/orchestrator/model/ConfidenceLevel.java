package com.dealflow.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
