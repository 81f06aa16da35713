package com.dealflow.orchestrator.stage.impl;

import com.dealflow.orchestrator.fragment.Fragment;
import com.dealflow.orchestrator.fragment.FragmentMerger;
import com.dealflow.orchestrator.fragment.Fragments;
import com.dealflow.orchestrator.model.PipelineInput;
import com.dealflow.orchestrator.reasoning.ReasoningClient;
import com.dealflow.orchestrator.reasoning.ReasoningOptions;
import com.dealflow.orchestrator.stage.FoundationalStage;
import com.dealflow.orchestrator.stage.StageException;
import com.dealflow.orchestrator.stage.StageNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Foundational stage: turns the deck into one structured company profile.
 *
 * The full text goes out in a single call (truncated to {@value #MAX_TEXT_CHARS}
 * characters); pages go out in batches of {@value #PAGE_BATCH_SIZE}. All
 * answers are folded by the {@link FragmentMerger}, text first, so facts read
 * from the whole text win over facts read from individual pages. Batches that
 * come back unparsable are skipped by the merger.
 *
 * The result always carries a {@code company_name} and a quality assessment
 * ({@code data_quality_flags}, {@code missing_data_points},
 * {@code extraction_confidence}).
 */
public class ExtractionStage extends ReasoningStage implements FoundationalStage {

    private static final Logger log = LoggerFactory.getLogger(ExtractionStage.class);

    static final int    PAGE_BATCH_SIZE = 5;
    static final int    MAX_TEXT_CHARS  = 50_000;
    static final String UNKNOWN_COMPANY = "Unknown Company";

    private final FragmentMerger merger;

    public ExtractionStage(ReasoningClient client, ReasoningOptions options, FragmentMerger merger) {
        super(client, options);
        this.merger = merger;
    }

    @Override
    public String name() { return StageNames.EXTRACTION; }

    @Override
    public Fragment execute(PipelineInput input) {
        if (input.isEmpty()) {
            throw new StageException(StageException.Kind.NON_RETRYABLE,
                    "No content provided for extraction");
        }
        log.info("[{}] Starting extraction: {} pages, {} chars text", name(),
                input.pages().size(), input.textContent() == null ? 0 : input.textContent().length());

        List<Fragment> parts = new ArrayList<>();
        if (hasText(input)) {
            parts.add(extractFromText(input));
        }
        parts.addAll(extractFromPages(input.pages()));

        Fragment merged = merger.merge(parts);
        Fragment.Mapping profile = merged instanceof Fragment.Mapping m ? m : Fragment.emptyMapping();

        Fragment.Mapping result = assessQuality(withCompanyName(profile, input.companyNameHint()));
        log.info("[{}] Extraction complete: {}", name(), Fragments.stringAt(result, "company_name").orElse(UNKNOWN_COMPANY));
        return result;
    }

    // ------------------------------------------------------------------
    // Reasoning calls
    // ------------------------------------------------------------------

    private Fragment extractFromText(PipelineInput input) {
        String text = input.textContent();
        if (text.length() > MAX_TEXT_CHARS) {
            text = text.substring(0, MAX_TEXT_CHARS);
        }
        String hint = input.companyNameHint() == null || input.companyNameHint().isBlank()
                ? ""
                : "Note: The company name is likely '" + input.companyNameHint() + "'.\n";
        String prompt = StagePrompts.EXTRACTION_TEXT.formatted(StagePrompts.EXTRACTION_SYSTEM, hint, text);
        return call(prompt, StagePrompts.EXTRACTION_SCHEMA);
    }

    private List<Fragment> extractFromPages(List<String> pages) {
        List<Fragment> batches = new ArrayList<>();
        int totalBatches = (pages.size() + PAGE_BATCH_SIZE - 1) / PAGE_BATCH_SIZE;

        for (int start = 0; start < pages.size(); start += PAGE_BATCH_SIZE) {
            List<String> batch = pages.subList(start, Math.min(start + PAGE_BATCH_SIZE, pages.size()));
            int batchNum = start / PAGE_BATCH_SIZE + 1;
            log.debug("[{}] Processing page batch {}/{}", name(), batchNum, totalBatches);

            String prompt = StagePrompts.EXTRACTION_PAGES.formatted(
                    StagePrompts.EXTRACTION_SYSTEM, start + 1, start + batch.size(), String.join("\n\n---\n\n", batch));
            Fragment answer = call(prompt, StagePrompts.EXTRACTION_SCHEMA);
            if (answer instanceof Fragment.Unparsable) {
                log.warn("[{}] Could not parse batch {} as JSON", name(), batchNum);
            }
            batches.add(answer);
        }
        return batches;
    }

    // ------------------------------------------------------------------
    // Post-processing
    // ------------------------------------------------------------------

    private static Fragment.Mapping withCompanyName(Fragment.Mapping profile, String hint) {
        if (Fragments.stringAt(profile, "company_name").isPresent()) {
            return profile;
        }
        String name = hint != null && !hint.isBlank() ? hint.trim() : UNKNOWN_COMPANY;
        return profile.with("company_name", Fragment.scalar(name));
    }

    /**
     * Flags missing critical data and lowers {@code extraction_confidence}
     * accordingly: 0.8 minus 0.1 per quality issue and 0.05 per missing point,
     * clamped to [0.1, 1.0].
     */
    static Fragment.Mapping assessQuality(Fragment.Mapping profile) {
        Set<String> issues  = new LinkedHashSet<>(Fragments.stringsAt(profile, "data_quality_flags"));
        Set<String> missing = new LinkedHashSet<>(Fragments.stringsAt(profile, "missing_data_points"));

        if (UNKNOWN_COMPANY.equals(Fragments.stringAt(profile, "company_name").orElse(UNKNOWN_COMPANY))) {
            issues.add("Company name not found");
        }
        if (Fragments.at(profile, "financials", "revenue").isEmpty()
                && Fragments.at(profile, "financials", "arr").isEmpty()) {
            missing.add("Revenue/ARR");
        }
        if (Fragments.at(profile, "financials", "revenue_growth_rate").isEmpty()) {
            missing.add("Growth rate");
        }
        if (Fragments.at(profile, "market", "tam").isEmpty()) {
            missing.add("TAM/Market size");
        }
        if (Fragments.stringsAt(profile, "team", "founders").isEmpty()) {
            missing.add("Founder information");
        }
        if (Fragments.at(profile, "financials", "current_round_size").isEmpty()
                && Fragments.at(profile, "funding_ask").isEmpty()) {
            missing.add("Funding ask");
        }

        double confidence = Math.max(0.1, Math.min(1.0, 0.8 - issues.size() * 0.1 - missing.size() * 0.05));

        return profile
                .with("data_quality_flags",    strings(issues))
                .with("missing_data_points",   strings(missing))
                .with("extraction_confidence", Fragment.scalar(Math.round(confidence * 100) / 100.0));
    }

    private static Fragment strings(Set<String> values) {
        return Fragment.sequence(values.stream().map(Fragment::scalar).toList());
    }

    private static boolean hasText(PipelineInput input) {
        return input.textContent() != null && !input.textContent().isBlank();
    }
}
