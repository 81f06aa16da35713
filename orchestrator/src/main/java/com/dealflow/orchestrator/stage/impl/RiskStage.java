package com.dealflow.orchestrator.stage.impl;

import com.dealflow.orchestrator.fragment.Fragment;
import com.dealflow.orchestrator.fragment.Fragments;
import com.dealflow.orchestrator.reasoning.ReasoningClient;
import com.dealflow.orchestrator.reasoning.ReasoningOptions;
import com.dealflow.orchestrator.stage.FanOutInput;
import com.dealflow.orchestrator.stage.FanOutStage;
import com.dealflow.orchestrator.stage.StageNames;

/** Risk register, deal breakers and the risk-adjusted recommendation. */
public class RiskStage extends ReasoningStage implements FanOutStage {

    public RiskStage(ReasoningClient client, ReasoningOptions options) {
        super(client, options);
    }

    @Override
    public String name() { return StageNames.RISK; }

    @Override
    public Fragment execute(FanOutInput input) {
        String prompt = StagePrompts.RISK.formatted(Fragments.toJsonString(input.foundation()));
        return callForMapping(prompt, StagePrompts.RISK_SCHEMA);
    }
}
