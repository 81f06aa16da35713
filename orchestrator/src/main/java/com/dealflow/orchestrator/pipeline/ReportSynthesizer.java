package com.dealflow.orchestrator.pipeline;

import com.dealflow.orchestrator.fragment.Fragment;
import com.dealflow.orchestrator.fragment.Fragments;
import com.dealflow.orchestrator.fragment.MonetaryValues;
import com.dealflow.orchestrator.model.ConfidenceLevel;
import com.dealflow.orchestrator.model.ExecutiveSummary;
import com.dealflow.orchestrator.model.Recommendation;
import com.dealflow.orchestrator.model.StageResult;
import com.dealflow.orchestrator.model.Synthesis;
import com.dealflow.orchestrator.stage.StageNames;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Combines the stage results of a run into the memo's conclusions.
 *
 * Pure and deterministic: no reasoning calls, only rules over the fragments.
 * Missing fields read as the neutral default (score 0, confidence 0,
 * premium 0, no critical risks), so fallback results flow through unchanged.
 */
public class ReportSynthesizer {

    static final double UPGRADE_SCORE       = 7.5;
    static final double OVERPRICED_PREMIUM  = -0.3;
    static final double CONFIDENT           = 0.7;
    static final double TRUSTWORTHY_DATA    = 0.8;
    static final int    MAX_DILIGENCE_ITEMS = 10;
    static final int    MAX_KEY_QUESTIONS   = 5;

    static final List<String> STANDARD_DILIGENCE = List.of(
            "Customer reference calls (3-5 customers)",
            "Management team background checks",
            "Financial model review and validation",
            "Legal document review (cap table, contracts)",
            "Technology/product deep dive"
    );

    private static final Map<Recommendation, List<String>> NEXT_STEPS = new EnumMap<>(Recommendation.class);
    static {
        NEXT_STEPS.put(Recommendation.STRONG_INVEST, List.of(
                "Schedule management meeting",
                "Begin legal due diligence",
                "Prepare term sheet draft"));
        NEXT_STEPS.put(Recommendation.INVEST, List.of(
                "Schedule management meeting",
                "Complete customer reference calls",
                "Review financial model in detail"));
        NEXT_STEPS.put(Recommendation.CONDITIONAL_INVEST, List.of(
                "Address key risks before proceeding",
                "Request additional data/documentation",
                "Conduct deeper competitive analysis"));
        NEXT_STEPS.put(Recommendation.MORE_DILIGENCE, List.of(
                "Request detailed financial model",
                "Conduct market research",
                "Complete background checks"));
        NEXT_STEPS.put(Recommendation.PASS, List.of(
                "Send pass letter with feedback",
                "Keep in database for future reference"));
        NEXT_STEPS.put(Recommendation.STRONG_PASS, List.of(
                "Send pass letter",
                "Document key concerns for record"));
    }

    public Synthesis synthesize(StageResult foundational, Map<String, StageResult> fanOut) {
        Fragment extraction = foundational.payload();
        Fragment analysis   = payloadOf(fanOut, StageNames.ANALYSIS);
        Fragment risk       = payloadOf(fanOut, StageNames.RISK);
        Fragment valuation  = payloadOf(fanOut, StageNames.VALUATION);

        Recommendation recommendation = recommend(analysis, risk, valuation);

        List<String> degraded = fanOut.entrySet().stream()
                .filter(e -> e.getValue().isFallback())
                .map(Map.Entry::getKey)
                .toList();

        return new Synthesis(
                recommendation,
                conviction(analysis, risk),
                executiveSummary(extraction, analysis, risk, valuation, recommendation),
                diligenceItems(risk),
                first(Fragments.stringsAt(analysis, "critical_questions"), MAX_KEY_QUESTIONS),
                degraded);
    }

    // ------------------------------------------------------------------
    // Rules
    // ------------------------------------------------------------------

    Recommendation recommend(Fragment analysis, Fragment risk, Fragment valuation) {
        Recommendation base = Recommendation.fromValue(
                Fragments.stringAt(risk, "risk_adjusted_recommendation").orElse(null),
                Recommendation.MORE_DILIGENCE);

        double score         = Fragments.doubleAt(analysis, "overall_attractiveness_score", "score").orElse(0.0);
        int    criticalRisks = Fragments.intAt(risk, "critical_risks").orElse(0);

        if (score >= UPGRADE_SCORE && criticalRisks == 0) {
            if (base == Recommendation.INVEST)             return Recommendation.STRONG_INVEST;
            if (base == Recommendation.CONDITIONAL_INVEST) return Recommendation.INVEST;
        }

        double premium = Fragments.doubleAt(valuation, "implied_discount_premium").orElse(0.0);
        if (premium < OVERPRICED_PREMIUM) {
            if (base == Recommendation.STRONG_INVEST) return Recommendation.INVEST;
            if (base == Recommendation.INVEST)        return Recommendation.CONDITIONAL_INVEST;
        }
        return base;
    }

    ConfidenceLevel conviction(Fragment analysis, Fragment risk) {
        int factors = 0;
        if (Fragments.doubleAt(analysis, "analysis_confidence").orElse(0.0) >= CONFIDENT)   factors++;
        if (Fragments.doubleAt(risk, "assessment_confidence").orElse(0.0) >= CONFIDENT)     factors++;
        if (Fragments.doubleAt(risk, "data_integrity_score").orElse(0.0) >= TRUSTWORTHY_DATA) factors++;
        if (Fragments.intAt(risk, "critical_risks").orElse(0) == 0)                          factors++;

        if (factors >= 3) return ConfidenceLevel.HIGH;
        if (factors >= 1) return ConfidenceLevel.MEDIUM;
        return ConfidenceLevel.LOW;
    }

    List<String> diligenceItems(Fragment risk) {
        Set<String> items = new LinkedHashSet<>(Fragments.stringsAt(risk, "must_verify_items"));
        items.addAll(STANDARD_DILIGENCE);
        return first(new ArrayList<>(items), MAX_DILIGENCE_ITEMS);
    }

    ExecutiveSummary executiveSummary(Fragment extraction,
                                      Fragment analysis,
                                      Fragment risk,
                                      Fragment valuation,
                                      Recommendation recommendation) {
        List<String> concerns = new ArrayList<>(Fragments.stringsAt(risk, "deal_breakers"));
        concerns.addAll(first(Fragments.stringsAt(analysis, "key_weaknesses"), 3));

        return new ExecutiveSummary(
                companyOverview(extraction),
                first(Fragments.stringsAt(analysis, "key_strengths"), 5),
                first(concerns, 5),
                recommendation,
                Fragments.stringAt(risk, "recommendation_reasoning").orElse(""),
                valuationSummary(valuation),
                NEXT_STEPS.getOrDefault(recommendation, List.of()));
    }

    // ------------------------------------------------------------------
    // Text
    // ------------------------------------------------------------------

    String companyOverview(Fragment extraction) {
        List<String> parts = new ArrayList<>();
        parts.add(companyName(extraction));
        Fragments.stringAt(extraction, "tagline").ifPresent(t -> parts.add("- " + t));
        Fragments.stringAt(extraction, "business_model").ifPresent(b -> parts.add("Business Model: " + b));
        Fragments.stringAt(extraction, "stage").ifPresent(s -> parts.add("Stage: " + titleCase(s)));
        Fragments.at(extraction, "financials", "revenue").ifPresent(revenue ->
                Fragments.stringAt(revenue, "amount").ifPresent(amount ->
                        parts.add("Revenue: $" + amount + Fragments.stringAt(revenue, "unit").orElse(""))));
        return String.join(" | ", parts);
    }

    String valuationSummary(Fragment valuation) {
        String summary = "Valuation Range: $%.0fM - $%.0fM (Mid: $%.0fM)".formatted(
                millions(valuation, "valuation_range_low"),
                millions(valuation, "valuation_range_high"),
                millions(valuation, "valuation_range_mid"));
        return Fragments.stringAt(valuation, "ask_vs_valuation")
                .map(ask -> summary + ". " + ask)
                .orElse(summary);
    }

    static String companyName(Fragment extraction) {
        return Fragments.stringAt(extraction, "company_name").orElse("Unknown Company");
    }

    private static double millions(Fragment valuation, String field) {
        return Fragments.doubleAt(valuation, field, "amount").orElse(0.0);
    }

    private static String titleCase(String snake) {
        return Arrays.stream(snake.split("_"))
                .filter(w -> !w.isEmpty())
                .map(w -> w.substring(0, 1).toUpperCase(Locale.ROOT) + w.substring(1).toLowerCase(Locale.ROOT))
                .reduce((a, b) -> a + " " + b)
                .orElse(snake);
    }

    private static Fragment payloadOf(Map<String, StageResult> fanOut, String stage) {
        StageResult result = fanOut.get(stage);
        return result != null ? result.payload() : Fragment.emptyMapping();
    }

    private static List<String> first(List<String> items, int n) {
        return items.size() <= n ? List.copyOf(items) : List.copyOf(items.subList(0, n));
    }
}
