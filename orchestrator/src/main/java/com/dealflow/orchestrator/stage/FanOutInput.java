package com.dealflow.orchestrator.stage;

import com.dealflow.orchestrator.fragment.Fragment;

import java.util.Optional;

/**
 * Read-only input shared by all fan-out stages.
 *
 * @param foundation       payload of the foundational stage
 * @param enrichmentSource another stage's genuine result, present only on an enrichment retry
 */
public record FanOutInput(Fragment foundation, Fragment enrichmentSource) {

    public static FanOutInput of(Fragment foundation) {
        return new FanOutInput(foundation, null);
    }

    public Optional<Fragment> enrichment() {
        return Optional.ofNullable(enrichmentSource);
    }
}
