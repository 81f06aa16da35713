package com.dealflow.orchestrator.model;

import com.dealflow.orchestrator.fragment.Fragment;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * The payload a stage contributed to the report: either what the stage really
 * produced, or a synthetic stand-in after the stage gave up.
 *
 * Serialised with a {@code "type": "success" | "fallback"} discriminator.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StageResult.Success.class,  name = "success"),
        @JsonSubTypes.Type(value = StageResult.Fallback.class, name = "fallback")
})
public sealed interface StageResult permits StageResult.Success, StageResult.Fallback {

    Fragment payload();

    @JsonIgnore
    default boolean isFallback() {
        return this instanceof Fallback;
    }

    record Success(Fragment payload) implements StageResult {}

    /** @param reason the error that exhausted the stage */
    record Fallback(Fragment payload, String reason) implements StageResult {}
}
