package com.dealflow.orchestrator.stage.impl;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prompt text and response schemas for each stage of the deck pipeline.
 *
 * Each prompt gives the reasoning service a role and the company data; the
 * schema gives the JSON shape to answer with. Field names here are the ones
 * the report synthesizer and fallback synthesizer read.
 */
final class StagePrompts {

    private StagePrompts() {}

    // ------------------------------------------------------------------
    // Extraction
    // ------------------------------------------------------------------

    static final String EXTRACTION_SYSTEM = """
            You are a meticulous investment analyst extracting facts from a startup pitch deck.
            Extract only what the deck states. Do not invent numbers. Use null for anything absent.
            Monetary values are objects: {"amount": number, "unit": "K" | "M" | "B" | "", "currency": "USD"}.
            """;

    static final String EXTRACTION_TEXT = """
            %s
            %s
            PITCH DECK TEXT CONTENT:
            %s

            Extract the company profile, team, financials, market, traction, competition and funding ask.
            """;

    static final String EXTRACTION_PAGES = """
            %s
            Pitch deck pages %d to %d:

            %s

            Extract every fact these pages contain about the company.
            """;

    static final Map<String, Object> EXTRACTION_SCHEMA = object(
            "company_name",           type("string"),
            "tagline",                type("string", "null"),
            "description",            type("string", "null"),
            "industry",               type("string", "null"),
            "business_model",         type("string", "null"),
            "stage",                  type("string", "null"),
            "team",                   type("object"),
            "financials",             type("object"),
            "market",                 type("object"),
            "traction",               type("object"),
            "competitors",            type("array"),
            "competitive_advantages", type("array"),
            "funding_ask",            type("object", "null"),
            "use_of_funds",           type("array"),
            "extraction_confidence",  type("number"),
            "data_quality_flags",     type("array"),
            "missing_data_points",    type("array"));

    // ------------------------------------------------------------------
    // Analysis
    // ------------------------------------------------------------------

    static final String ANALYSIS = """
            You are a senior investment professional evaluating a company for a growth equity fund.
            Be rigorous, data-driven and sceptical of claims without evidence.

            COMPANY DATA:
            %s

            Score business model, market, competition, growth, unit economics and team on a 0-10 scale,
            each with a confidence ("high" | "medium" | "low") and reasoning. Then give an overall
            attractiveness score, the key strengths and weaknesses, the critical questions for
            management and your investment thesis.
            """;

    static final Map<String, Object> ANALYSIS_SCHEMA = object(
            "business_model",               type("object"),
            "market_analysis",              type("object"),
            "competitive_analysis",         type("object"),
            "growth_analysis",              type("object"),
            "unit_economics_quality",       score(),
            "team_assessment",              score(),
            "investment_thesis",            type("object"),
            "overall_attractiveness_score", score(),
            "key_strengths",                type("array"),
            "key_weaknesses",               type("array"),
            "critical_questions",           type("array"),
            "analysis_confidence",          type("number"));

    // ------------------------------------------------------------------
    // Risk
    // ------------------------------------------------------------------

    static final String RISK = """
            You are a risk officer on an investment committee. Your job is to find what could go wrong.

            COMPANY DATA:
            %s

            Identify financial, market, execution, team and data-integrity risks with severity.
            Count the critical risks, list deal breakers and the items that must be verified in
            diligence, score data integrity from 0 to 1, and give a risk-adjusted recommendation:
            one of strong_invest, invest, conditional_invest, more_diligence, pass, strong_pass.
            """;

    static final Map<String, Object> RISK_SCHEMA = object(
            "overall_risk_score",           type("number"),
            "risks",                        type("array"),
            "critical_risks",               type("integer"),
            "deal_breakers",                type("array"),
            "must_verify_items",            type("array"),
            "data_integrity_score",         type("number"),
            "risk_adjusted_recommendation", type("string"),
            "recommendation_reasoning",     type("string"),
            "assessment_confidence",        type("number"));

    // ------------------------------------------------------------------
    // Valuation
    // ------------------------------------------------------------------

    static final String VALUATION = """
            You are a valuation specialist. Value the company with comparable multiples and, where
            the data allows, a simple DCF. Amounts are in millions ("unit": "M").

            COMPANY DATA:
            %s
            %s
            Give a low / mid / high valuation range, a probability-weighted value, the methodologies
            used, how the ask compares to your valuation, and the implied discount (positive) or
            premium (negative) of the ask versus your mid value as a fraction.
            """;

    static final String VALUATION_ANALYSIS_CONTEXT = """

            ANALYST ASSESSMENT:
            %s
            """;

    static final Map<String, Object> VALUATION_SCHEMA = object(
            "valuation_range_low",        money(),
            "valuation_range_mid",        money(),
            "valuation_range_high",       money(),
            "probability_weighted_value", money(),
            "valuation_confidence",       type("string"),
            "methodologies_used",         type("array"),
            "key_valuation_risks",        type("array"),
            "ask_vs_valuation",           type("string"),
            "implied_discount_premium",   type("number"));

    // ------------------------------------------------------------------
    // Schema helpers
    // ------------------------------------------------------------------

    private static Map<String, Object> object(Object... nameTypePairs) {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (int i = 0; i < nameTypePairs.length; i += 2) {
            properties.put((String) nameTypePairs[i], nameTypePairs[i + 1]);
        }
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        return schema;
    }

    private static Map<String, Object> type(String... types) {
        return Map.of("type", types.length == 1 ? types[0] : List.of(types));
    }

    private static Map<String, Object> score() {
        return object("score", type("number"), "confidence", type("string"), "reasoning", type("string"));
    }

    private static Map<String, Object> money() {
        return object("amount", type("number"), "unit", type("string"), "currency", type("string"));
    }
}
