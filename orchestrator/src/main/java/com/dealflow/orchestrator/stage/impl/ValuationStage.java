package com.dealflow.orchestrator.stage.impl;

import com.dealflow.orchestrator.fragment.Fragment;
import com.dealflow.orchestrator.fragment.Fragments;
import com.dealflow.orchestrator.reasoning.ReasoningClient;
import com.dealflow.orchestrator.reasoning.ReasoningOptions;
import com.dealflow.orchestrator.stage.FanOutInput;
import com.dealflow.orchestrator.stage.FanOutStage;
import com.dealflow.orchestrator.stage.StageNames;

/**
 * Valuation range for the company. On an enrichment retry the analysis
 * result is appended to the prompt as extra context.
 */
public class ValuationStage extends ReasoningStage implements FanOutStage {

    public ValuationStage(ReasoningClient client, ReasoningOptions options) {
        super(client, options);
    }

    @Override
    public String name() { return StageNames.VALUATION; }

    @Override
    public Fragment execute(FanOutInput input) {
        String analysisContext = input.enrichment()
                .map(a -> StagePrompts.VALUATION_ANALYSIS_CONTEXT.formatted(Fragments.toJsonString(a)))
                .orElse("");
        String prompt = StagePrompts.VALUATION.formatted(
                Fragments.toJsonString(input.foundation()), analysisContext);
        return callForMapping(prompt, StagePrompts.VALUATION_SCHEMA);
    }
}
