package com.dealflow.orchestrator.reasoning;

import com.dealflow.orchestrator.fragment.Fragment;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * {@link ReasoningClient} over the Gemini {@code generateContent} REST endpoint.
 *
 * Raw HttpClient + Jackson, no SDK. The client makes exactly one HTTP call per
 * invocation; retrying is the stage runner's job, so this class only has to
 * say whether a failure is worth retrying:
 *
 * <pre>
 *   429             → RATE_LIMITED
 *   5xx, I/O error  → TRANSIENT
 *   other 4xx       → PERMANENT   (invalid argument, permission denied)
 * </pre>
 */
public class GeminiReasoningClient implements ReasoningClient {

    private static final Logger log = LoggerFactory.getLogger(GeminiReasoningClient.class);

    // -------------------------------------------------------------------------
    // Wire records
    // -------------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GenerateResponse(List<Candidate> candidates) {

        @JsonIgnoreProperties(ignoreUnknown = true)
        record Candidate(Content content) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        record Content(List<Part> parts) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        record Part(String text) {}

        /** Text of the first part of the first candidate, or null if the reply is empty. */
        String firstText() {
            if (candidates == null || candidates.isEmpty()) return null;
            Content content = candidates.get(0).content();
            if (content == null || content.parts() == null || content.parts().isEmpty()) return null;
            return content.parts().get(0).text();
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private final HttpClient            http;
    private final ObjectMapper          json;
    private final JsonResponseExtractor extractor;
    private final String                baseUrl;
    private final String                apiKey;
    private final String                defaultModel;
    private final Duration              requestTimeout;

    public GeminiReasoningClient(String baseUrl,
                                 String apiKey,
                                 String defaultModel,
                                 Duration requestTimeout,
                                 ObjectMapper objectMapper) {
        this.baseUrl        = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey         = apiKey;
        this.defaultModel   = defaultModel;
        this.requestTimeout = requestTimeout;
        this.json           = objectMapper;
        this.extractor      = new JsonResponseExtractor(objectMapper);
        this.http           = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // ReasoningClient
    // -------------------------------------------------------------------------

    @Override
    public Fragment invoke(String prompt, Map<String, Object> schema, ReasoningOptions options) {
        String model = options.model() != null ? options.model() : defaultModel;
        String body  = requestBody(structuredPrompt(prompt, schema), options.temperature());

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/v1beta/models/" + model + ":generateContent?key="
                        + URLEncoder.encode(apiKey, StandardCharsets.UTF_8)))
                .timeout(requestTimeout)
                .header("content-type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ReasoningException(ReasoningException.Kind.TRANSIENT,
                    "Reasoning service unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReasoningException(ReasoningException.Kind.TRANSIENT,
                    "Reasoning call interrupted", e);
        }

        int status = response.statusCode();
        if (status != 200) {
            ReasoningException.Kind kind = classify(status);
            log.warn("Reasoning service returned {} ({}) for model {}", status, kind, model);
            throw new ReasoningException(kind, status,
                    "Reasoning service error %d: %s".formatted(status, abbreviate(response.body())));
        }

        String text;
        try {
            text = json.readValue(response.body(), GenerateResponse.class).firstText();
        } catch (JsonProcessingException e) {
            log.warn("Reasoning service envelope could not be parsed: {}", e.getOriginalMessage());
            return Fragment.unparsable(response.body());
        }
        if (text == null) {
            return Fragment.unparsable("");
        }
        return extractor.extract(text);
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    static ReasoningException.Kind classify(int statusCode) {
        if (statusCode == 429) return ReasoningException.Kind.RATE_LIMITED;
        if (statusCode >= 500) return ReasoningException.Kind.TRANSIENT;
        return ReasoningException.Kind.PERMANENT;
    }

    String structuredPrompt(String prompt, Map<String, Object> schema) {
        String schemaText;
        try {
            schemaText = json.writerWithDefaultPrettyPrinter().writeValueAsString(schema);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Schema is not serialisable", e);
        }
        return """
                %s

                IMPORTANT: You must respond with valid JSON only. No markdown, no explanation, just the JSON object.

                The response must match this JSON schema:
                ```json
                %s
                ```

                Respond with only the JSON object:""".formatted(prompt, schemaText);
    }

    private String requestBody(String prompt, double temperature) {
        try {
            return json.writeValueAsString(Map.of(
                    "contents", List.of(Map.of(
                            "role",  "user",
                            "parts", List.of(Map.of("text", prompt)))),
                    "generationConfig", Map.of("temperature", temperature)
            ));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Request body could not be serialised", e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= 500 ? body : body.substring(0, 500) + "...";
    }
}
