package com.dealflow.orchestrator.reasoning;

import com.dealflow.orchestrator.fragment.Fragment;
import com.dealflow.orchestrator.fragment.Fragments;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests GeminiReasoningClient against an in-process HTTP server standing in
 * for the generateContent endpoint.
 */
class GeminiReasoningClientTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    HttpServer                server;
    GeminiReasoningClient     client;
    AtomicReference<String>   lastPath = new AtomicReference<>();
    AtomicReference<String>   lastBody = new AtomicReference<>();
    volatile int              replyStatus;
    volatile String           replyBody;

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            lastPath.set(exchange.getRequestURI().toString());
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = replyBody.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(replyStatus, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        client = new GeminiReasoningClient(
                "http://127.0.0.1:" + server.getAddress().getPort() + "/",
                "test-key", "gemini-1.5-pro", Duration.ofSeconds(5), JSON);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void reply(int status, String body) {
        replyStatus = status;
        replyBody   = body;
    }

    private static String envelope(String text) throws Exception {
        return JSON.writeValueAsString(Map.of("candidates", List.of(
                Map.of("content", Map.of("parts", List.of(Map.of("text", text)))))));
    }

    // ------------------------------------------------------------------
    // Success
    // ------------------------------------------------------------------

    @Test
    void invoke_okResponse_extractsJsonFromFirstCandidate() throws Exception {
        reply(200, envelope("```json\n{\"company_name\": \"Acme\"}\n```"));

        Fragment f = client.invoke("Describe Acme", Map.of("type", "object"), new ReasoningOptions(null, 0.2));

        assertThat(Fragments.stringAt(f, "company_name")).contains("Acme");
        assertThat(lastPath.get()).isEqualTo("/v1beta/models/gemini-1.5-pro:generateContent?key=test-key");

        JsonNode sent = JSON.readTree(lastBody.get());
        assertThat(sent.at("/contents/0/parts/0/text").asText())
                .startsWith("Describe Acme")
                .contains("valid JSON only");
        assertThat(sent.at("/generationConfig/temperature").asDouble()).isEqualTo(0.2);
    }

    @Test
    void invoke_modelInOptions_overridesDefaultModel() throws Exception {
        reply(200, envelope("{}"));

        client.invoke("p", Map.of(), new ReasoningOptions("gemini-1.5-flash", 0.0));

        assertThat(lastPath.get()).startsWith("/v1beta/models/gemini-1.5-flash:generateContent");
    }

    @Test
    void invoke_nonJsonAnswer_returnsUnparsable() throws Exception {
        reply(200, envelope("Sorry, I can't read this deck."));

        assertThat(client.invoke("p", Map.of(), new ReasoningOptions(null, 0.2)))
                .isEqualTo(Fragment.unparsable("Sorry, I can't read this deck."));
    }

    @Test
    void invoke_emptyCandidates_returnsUnparsable() {
        reply(200, "{\"candidates\": []}");

        assertThat(client.invoke("p", Map.of(), new ReasoningOptions(null, 0.2)))
                .isInstanceOf(Fragment.Unparsable.class);
    }

    // ------------------------------------------------------------------
    // Failures
    // ------------------------------------------------------------------

    @Test
    void invoke_rateLimited_throwsRetryableException() {
        reply(429, "{\"error\": {\"status\": \"RESOURCE_EXHAUSTED\"}}");

        assertThatThrownBy(() -> client.invoke("p", Map.of(), new ReasoningOptions(null, 0.2)))
                .isInstanceOf(ReasoningException.class)
                .satisfies(e -> {
                    ReasoningException re = (ReasoningException) e;
                    assertThat(re.getKind()).isEqualTo(ReasoningException.Kind.RATE_LIMITED);
                    assertThat(re.getStatusCode()).isEqualTo(429);
                    assertThat(re.isRetryable()).isTrue();
                });
    }

    @Test
    void invoke_permissionDenied_throwsPermanentException() {
        reply(403, "{\"error\": {\"status\": \"PERMISSION_DENIED\"}}");

        assertThatThrownBy(() -> client.invoke("p", Map.of(), new ReasoningOptions(null, 0.2)))
                .isInstanceOf(ReasoningException.class)
                .satisfies(e -> assertThat(((ReasoningException) e).isRetryable()).isFalse())
                .hasMessageContaining("403");
    }

    @Test
    void invoke_serverUnreachable_throwsTransientException() {
        server.stop(0);

        assertThatThrownBy(() -> client.invoke("p", Map.of(), new ReasoningOptions(null, 0.2)))
                .isInstanceOf(ReasoningException.class)
                .satisfies(e -> assertThat(((ReasoningException) e).getKind())
                        .isEqualTo(ReasoningException.Kind.TRANSIENT));
    }

    @Test
    void classify_mapsStatusCodes() {
        assertThat(GeminiReasoningClient.classify(429)).isEqualTo(ReasoningException.Kind.RATE_LIMITED);
        assertThat(GeminiReasoningClient.classify(500)).isEqualTo(ReasoningException.Kind.TRANSIENT);
        assertThat(GeminiReasoningClient.classify(503)).isEqualTo(ReasoningException.Kind.TRANSIENT);
        assertThat(GeminiReasoningClient.classify(400)).isEqualTo(ReasoningException.Kind.PERMANENT);
        assertThat(GeminiReasoningClient.classify(404)).isEqualTo(ReasoningException.Kind.PERMANENT);
    }
}
