package com.dealflow.orchestrator.reasoning;

import com.dealflow.orchestrator.fragment.Fragment;

import java.util.Map;

/**
 * A single structured call to the generative reasoning service.
 *
 * Implementations ask the service to answer {@code prompt} with JSON shaped like
 * {@code schema} and return the parsed answer. A reply that contains no usable
 * JSON comes back as {@link Fragment.Unparsable}, not as an exception.
 */
public interface ReasoningClient {

    /**
     * @throws ReasoningException when the call itself fails
     */
    Fragment invoke(String prompt, Map<String, Object> schema, ReasoningOptions options);
}
