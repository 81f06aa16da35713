package com.dealflow.orchestrator.reasoning;

import com.dealflow.orchestrator.fragment.Fragment;
import com.dealflow.orchestrator.fragment.Fragments;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a JSON document out of free-form model output.
 *
 * Models are asked for bare JSON but often wrap it in prose or a markdown
 * fence. Tried in order:
 *   1. every ```json ... ``` (or bare ```) fenced block
 *   2. the outermost {...} span
 *   3. the outermost [...] span, wrapped as {"items": [...]}
 *   4. the whole text
 * If none parses, the raw text is kept as {@link Fragment.Unparsable}.
 */
public class JsonResponseExtractor {

    private static final Pattern FENCED_BLOCK = Pattern.compile(
            "```(?:json)?\\s*(.*?)```",
            Pattern.DOTALL
    );

    private static final Pattern OBJECT_SPAN = Pattern.compile("\\{.*}", Pattern.DOTALL);

    private static final Pattern ARRAY_SPAN  = Pattern.compile("\\[.*]", Pattern.DOTALL);

    private final ObjectMapper json;

    public JsonResponseExtractor(ObjectMapper json) {
        this.json = json;
    }

    public Fragment extract(String text) {
        if (text == null || text.isBlank()) {
            return Fragment.unparsable(text == null ? "" : text);
        }

        Matcher fenced = FENCED_BLOCK.matcher(text);
        while (fenced.find()) {
            Optional<JsonNode> node = tryParse(fenced.group(1).strip());
            if (node.isPresent()) {
                return toFragment(node.get());
            }
        }

        Matcher obj = OBJECT_SPAN.matcher(text);
        if (obj.find()) {
            Optional<JsonNode> node = tryParse(obj.group());
            if (node.isPresent()) {
                return toFragment(node.get());
            }
        }

        Matcher arr = ARRAY_SPAN.matcher(text);
        if (arr.find()) {
            Optional<JsonNode> node = tryParse(arr.group());
            if (node.isPresent()) {
                return toFragment(node.get());
            }
        }

        return tryParse(text.strip())
                .map(this::toFragment)
                .orElseGet(() -> Fragment.unparsable(text));
    }

    private Fragment toFragment(JsonNode node) {
        Fragment f = Fragments.fromJson(node);
        if (node.isArray()) {
            return Fragment.mapping(Map.of("items", f));
        }
        return f;
    }

    private Optional<JsonNode> tryParse(String candidate) {
        try {
            JsonNode node = json.readTree(candidate);
            return node == null || node.isMissingNode() ? Optional.empty() : Optional.of(node);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
