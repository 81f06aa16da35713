package com.dealflow.orchestrator.stage;

/** Names of the stages in the deck-analysis pipeline. */
public final class StageNames {

    public static final String EXTRACTION = "extraction";
    public static final String ANALYSIS   = "analysis";
    public static final String RISK       = "risk";
    public static final String VALUATION  = "valuation";

    private StageNames() {}
}
