package com.dealflow.orchestrator.fallback;

import com.dealflow.orchestrator.fragment.Fragment;
import com.dealflow.orchestrator.fragment.Fragments;
import com.dealflow.orchestrator.fragment.MonetaryValues;
import com.dealflow.orchestrator.model.ConfidenceLevel;
import com.dealflow.orchestrator.model.Recommendation;
import com.dealflow.orchestrator.stage.StageNames;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the stand-in result for a fan-out stage that exhausted its retries.
 *
 * Output is a schema-valid, deliberately neutral document for the stage,
 * always flagged {@code "synthetic": true} and {@code "confidence": "low"} so
 * synthesis and readers can tell it apart from real analysis. The same context
 * always yields the same fragment. This class never throws.
 */
public class FallbackSynthesizer {

    static final double NEUTRAL_SCORE          = 5.0;
    static final double FALLBACK_CONFIDENCE    = 0.2;
    static final double DEFAULT_VALUATION_M    = 50.0;
    static final double REVENUE_MULTIPLE       = 10.0;

    private static final String MANUAL_REVIEW = "manual review required";

    /**
     * @param stageName        stage whose slot is being filled
     * @param availableContext the foundational payload (may be null or empty)
     */
    public Fragment synthesize(String stageName, Fragment availableContext) {
        Fragment context = availableContext != null ? availableContext : Fragment.emptyMapping();
        String   name    = stageName != null ? stageName : "unknown";
        Map<String, Fragment> doc = switch (name) {
            case StageNames.ANALYSIS  -> analysis();
            case StageNames.RISK      -> risk();
            case StageNames.VALUATION -> valuation(context);
            default                   -> generic(name);
        };
        doc.put("synthetic",  Fragment.scalar(true));
        doc.put("confidence", Fragment.scalar(ConfidenceLevel.LOW.value()));
        return new Fragment.Mapping(doc);
    }

    // ------------------------------------------------------------------
    // Per-stage documents
    // ------------------------------------------------------------------

    private Map<String, Fragment> analysis() {
        Map<String, Fragment> doc = new LinkedHashMap<>();
        doc.put("business_model", group(
                "overall_score", "revenue_quality", "margin_structure",
                "scalability", "defensibility", "capital_efficiency"));
        doc.put("market_analysis", group("market_score", "tam_validity", "market_timing"));
        doc.put("competitive_analysis", group(
                "competitive_score", "differentiation_strength", "barriers_to_entry"));
        doc.put("growth_analysis", group("growth_score", "growth_sustainability"));
        doc.put("unit_economics_quality", defaultScore());
        doc.put("team_assessment", defaultScore());
        Map<String, Fragment> thesis = new LinkedHashMap<>();
        thesis.put("thesis_statement",  Fragment.scalar("Analysis incomplete - " + MANUAL_REVIEW));
        thesis.put("thesis_confidence", Fragment.scalar(ConfidenceLevel.LOW.value()));
        doc.put("investment_thesis", new Fragment.Mapping(thesis));
        doc.put("overall_attractiveness_score", defaultScore());
        doc.put("key_strengths",       emptyList());
        doc.put("key_weaknesses",      emptyList());
        doc.put("critical_questions",  emptyList());
        doc.put("analysis_confidence", Fragment.scalar(FALLBACK_CONFIDENCE));
        return doc;
    }

    private Map<String, Fragment> risk() {
        Map<String, Fragment> doc = new LinkedHashMap<>();
        doc.put("overall_risk_score", Fragment.scalar(NEUTRAL_SCORE));
        doc.put("risk_adjusted_recommendation", Fragment.scalar(Recommendation.MORE_DILIGENCE.value()));
        doc.put("recommendation_reasoning",
                Fragment.scalar("Risk assessment incomplete - " + MANUAL_REVIEW));
        doc.put("risks",                 emptyList());
        doc.put("critical_risks",        Fragment.scalar(0));
        doc.put("deal_breakers",         emptyList());
        doc.put("must_verify_items",     emptyList());
        doc.put("data_integrity_score",  Fragment.scalar(0.0));
        doc.put("assessment_confidence", Fragment.scalar(FALLBACK_CONFIDENCE));
        return doc;
    }

    private Map<String, Fragment> valuation(Fragment context) {
        double base = Fragments.at(context, "financials", "revenue")
                .flatMap(MonetaryValues::normalizedAmount)
                .filter(revenue -> revenue > 0)
                .map(revenue -> revenue * REVENUE_MULTIPLE / 1_000_000)
                .orElse(DEFAULT_VALUATION_M);

        Map<String, Fragment> doc = new LinkedHashMap<>();
        doc.put("valuation_range_low",  money(base * 0.7));
        doc.put("valuation_range_mid",  money(base));
        doc.put("valuation_range_high", money(base * 1.3));
        doc.put("probability_weighted_value", money(base));
        doc.put("valuation_confidence", Fragment.scalar(ConfidenceLevel.LOW.value()));
        doc.put("key_valuation_risks", Fragment.sequence(List.of(
                Fragment.scalar("Valuation analysis incomplete - estimates only"))));
        doc.put("methodologies_used", Fragment.sequence(List.of(
                Fragment.scalar("Fallback Estimate"))));
        doc.put("implied_discount_premium", Fragment.scalar(0.0));
        return doc;
    }

    private Map<String, Fragment> generic(String stageName) {
        Map<String, Fragment> doc = new LinkedHashMap<>();
        doc.put("stage",   Fragment.scalar(stageName));
        doc.put("summary", Fragment.scalar(stageName + " incomplete - " + MANUAL_REVIEW));
        return doc;
    }

    // ------------------------------------------------------------------
    // Building blocks
    // ------------------------------------------------------------------

    private static Fragment defaultScore() {
        Map<String, Fragment> fields = new LinkedHashMap<>();
        fields.put("score",      Fragment.scalar(NEUTRAL_SCORE));
        fields.put("confidence", Fragment.scalar(ConfidenceLevel.LOW.value()));
        fields.put("reasoning",  Fragment.scalar("Stage failed - using default values"));
        return new Fragment.Mapping(fields);
    }

    private static Fragment group(String... scoreNames) {
        Map<String, Fragment> fields = new LinkedHashMap<>();
        for (String name : scoreNames) {
            fields.put(name, defaultScore());
        }
        return new Fragment.Mapping(fields);
    }

    private static Fragment money(double amountMillions) {
        Map<String, Fragment> fields = new LinkedHashMap<>();
        fields.put("amount", Fragment.scalar(amountMillions));
        fields.put("unit",   Fragment.scalar("M"));
        return new Fragment.Mapping(fields);
    }

    private static Fragment emptyList() {
        return Fragment.sequence(List.of());
    }
}
