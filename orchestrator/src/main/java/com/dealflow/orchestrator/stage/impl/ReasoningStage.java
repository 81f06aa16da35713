package com.dealflow.orchestrator.stage.impl;

import com.dealflow.orchestrator.fragment.Fragment;
import com.dealflow.orchestrator.reasoning.ReasoningClient;
import com.dealflow.orchestrator.reasoning.ReasoningException;
import com.dealflow.orchestrator.reasoning.ReasoningOptions;
import com.dealflow.orchestrator.stage.StageException;

import java.util.Map;

/**
 * Shared plumbing for stages backed by one or more reasoning calls: maps
 * client failures onto the stage runner's retry vocabulary.
 *
 * <pre>
 *   PERMANENT                 → StageException NON_RETRYABLE
 *   RATE_LIMITED, TRANSIENT   → StageException OPERATION_ERROR
 *   non-mapping response      → StageException OPERATION_ERROR
 * </pre>
 */
abstract class ReasoningStage {

    protected final ReasoningClient  client;
    protected final ReasoningOptions options;

    protected ReasoningStage(ReasoningClient client, ReasoningOptions options) {
        this.client  = client;
        this.options = options;
    }

    public abstract String name();

    /** One call whose answer may be anything, including {@link Fragment.Unparsable}. */
    protected Fragment call(String prompt, Map<String, Object> schema) {
        try {
            return client.invoke(prompt, schema, options);
        } catch (ReasoningException e) {
            if (e.isRetryable()) {
                throw StageException.retryable(name() + " reasoning call failed: " + e.getMessage(), e);
            }
            throw StageException.permanent(name() + " reasoning call rejected: " + e.getMessage(), e);
        }
    }

    /** One call whose answer must be a JSON object. */
    protected Fragment.Mapping callForMapping(String prompt, Map<String, Object> schema) {
        Fragment answer = call(prompt, schema);
        if (answer instanceof Fragment.Mapping mapping) {
            return mapping;
        }
        throw new StageException(StageException.Kind.OPERATION_ERROR,
                name() + " returned " + describe(answer) + " instead of a JSON object");
    }

    private static String describe(Fragment f) {
        if (f instanceof Fragment.Unparsable) return "unparsable text";
        if (f instanceof Fragment.Sequence)   return "a JSON array";
        return "a scalar";
    }
}
