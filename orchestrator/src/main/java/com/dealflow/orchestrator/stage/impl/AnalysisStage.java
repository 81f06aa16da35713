package com.dealflow.orchestrator.stage.impl;

import com.dealflow.orchestrator.fragment.Fragment;
import com.dealflow.orchestrator.fragment.Fragments;
import com.dealflow.orchestrator.reasoning.ReasoningClient;
import com.dealflow.orchestrator.reasoning.ReasoningOptions;
import com.dealflow.orchestrator.stage.FanOutInput;
import com.dealflow.orchestrator.stage.FanOutStage;
import com.dealflow.orchestrator.stage.StageNames;

/** Business, market, competition and growth assessment of the extracted company. */
public class AnalysisStage extends ReasoningStage implements FanOutStage {

    public AnalysisStage(ReasoningClient client, ReasoningOptions options) {
        super(client, options);
    }

    @Override
    public String name() { return StageNames.ANALYSIS; }

    @Override
    public Fragment execute(FanOutInput input) {
        String prompt = StagePrompts.ANALYSIS.formatted(Fragments.toJsonString(input.foundation()));
        return callForMapping(prompt, StagePrompts.ANALYSIS_SCHEMA);
    }
}
