package com.dealflow.orchestrator.model;

import java.util.List;

/**
 * What a pipeline run starts from. Pages are the already-converted text of
 * each document page; {@code textContent} is the whole document as one string.
 * Either may be empty, but not both.
 */
public record PipelineInput(String companyNameHint, List<String> pages, String textContent) {

    public PipelineInput {
        pages = pages == null ? List.of() : List.copyOf(pages);
    }

    public boolean isEmpty() {
        return pages.isEmpty() && (textContent == null || textContent.isBlank());
    }
}
