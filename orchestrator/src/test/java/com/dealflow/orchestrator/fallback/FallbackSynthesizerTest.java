package com.dealflow.orchestrator.fallback;

import com.dealflow.orchestrator.fragment.Fragment;
import com.dealflow.orchestrator.fragment.Fragments;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class FallbackSynthesizerTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final FallbackSynthesizer synthesizer = new FallbackSynthesizer();

    private static Fragment json(String text) throws Exception {
        return Fragments.fromJson(JSON.readTree(text));
    }

    @Test
    void synthesize_everyStage_isFlaggedSyntheticWithLowConfidence() {
        for (String stage : new String[] {"analysis", "risk", "valuation", "market_sizing"}) {
            Fragment doc = synthesizer.synthesize(stage, Fragment.emptyMapping());

            assertThat(Fragments.booleanAt(doc, "synthetic")).as(stage).isTrue();
            assertThat(Fragments.stringAt(doc, "confidence")).as(stage).contains("low");
        }
    }

    @Test
    void synthesize_analysis_hasNeutralScoresAndEmptyLists() {
        Fragment doc = synthesizer.synthesize("analysis", null);

        assertThat(Fragments.doubleAt(doc, "overall_attractiveness_score", "score")).contains(5.0);
        assertThat(Fragments.doubleAt(doc, "business_model", "scalability", "score")).contains(5.0);
        assertThat(Fragments.stringsAt(doc, "key_strengths")).isEmpty();
        assertThat(Fragments.doubleAt(doc, "analysis_confidence")).contains(0.2);
    }

    @Test
    void synthesize_risk_recommendsMoreDiligenceWithNoCriticalRisks() {
        Fragment doc = synthesizer.synthesize("risk", Fragment.emptyMapping());

        assertThat(Fragments.stringAt(doc, "risk_adjusted_recommendation")).contains("more_diligence");
        assertThat(Fragments.intAt(doc, "critical_risks")).contains(0);
        assertThat(Fragments.doubleAt(doc, "overall_risk_score")).contains(5.0);
    }

    @Test
    void synthesize_valuationWithRevenue_usesTenTimesRevenueInMillions() throws Exception {
        Fragment context = json("{\"financials\": {\"revenue\": {\"amount\": 2, \"unit\": \"M\"}}}");

        Fragment doc = synthesizer.synthesize("valuation", context);

        assertThat(Fragments.doubleAt(doc, "valuation_range_mid", "amount")).contains(20.0);
        assertThat(Fragments.doubleAt(doc, "valuation_range_low", "amount").orElseThrow()).isCloseTo(14.0, offset(1e-9));
        assertThat(Fragments.doubleAt(doc, "valuation_range_high", "amount").orElseThrow()).isCloseTo(26.0, offset(1e-9));
        assertThat(Fragments.stringAt(doc, "valuation_range_mid", "unit")).contains("M");
        assertThat(Fragments.stringsAt(doc, "methodologies_used")).containsExactly("Fallback Estimate");
    }

    @Test
    void synthesize_valuationWithoutRevenue_usesDefaultFiftyMillion() {
        Fragment doc = synthesizer.synthesize("valuation", Fragment.emptyMapping());

        assertThat(Fragments.doubleAt(doc, "valuation_range_mid", "amount")).contains(50.0);
        assertThat(Fragments.doubleAt(doc, "implied_discount_premium")).contains(0.0);
    }

    @Test
    void synthesize_unknownStage_isGenericDocument() {
        Fragment doc = synthesizer.synthesize("market_sizing", Fragment.emptyMapping());

        assertThat(Fragments.stringAt(doc, "stage")).contains("market_sizing");
        assertThat(Fragments.stringAt(doc, "summary")).hasValueSatisfying(s -> assertThat(s).contains("incomplete"));
    }

    @Test
    void synthesize_nullStageName_isGenericUnknown() {
        assertThat(Fragments.stringAt(synthesizer.synthesize(null, null), "stage")).contains("unknown");
    }

    @Test
    void synthesize_sameInput_isDeterministic() throws Exception {
        Fragment context = json("{\"financials\": {\"revenue\": {\"amount\": 500, \"unit\": \"K\"}}}");

        assertThat(synthesizer.synthesize("valuation", context))
                .isEqualTo(synthesizer.synthesize("valuation", context));
        assertThat(Fragments.toJsonString(synthesizer.synthesize("analysis", context)))
                .isEqualTo(Fragments.toJsonString(synthesizer.synthesize("analysis", context)));
    }
}
