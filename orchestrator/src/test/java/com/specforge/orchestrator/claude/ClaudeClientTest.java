package com.specforge.orchestrator.claude;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.specforge.orchestrator.claude.ClaudeClient.ClaudeApiException;
import com.specforge.orchestrator.config.PipelineProperties;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ClaudeClient against a local stand-in for the Messages API.
 */
class ClaudeClientTest {

    private final ObjectMapper json = new ObjectMapper();

    HttpServer                server;
    ClaudeClient              client;
    AtomicReference<String>   lastBody   = new AtomicReference<>();
    AtomicReference<String>   lastApiKey = new AtomicReference<>();
    volatile int              status;
    volatile String           reply;

    @BeforeEach
    void setUp() throws IOException {
        status = 200;
        reply  = "{\"content\": [{\"type\": \"text\", \"text\": \"hello\"}], \"stop_reason\": \"end_turn\"}";
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/messages", ex -> {
            lastBody.set(new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            lastApiKey.set(ex.getRequestHeaders().getFirst("x-api-key"));
            byte[] bytes = reply.getBytes(StandardCharsets.UTF_8);
            ex.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = ex.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        client = new ClaudeClient("sk-test", "http://127.0.0.1:" + server.getAddress().getPort(),
                PipelineProperties.defaults(), json);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void complete_sendsSingleUserTurnWithLimits() throws Exception {
        assertThat(client.complete("write a file", 512, 0.3)).isEqualTo("hello");

        JsonNode body = json.readTree(lastBody.get());
        assertThat(body.path("model").asText()).isEqualTo("claude-sonnet-4-6");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(512);
        assertThat(body.path("temperature").asDouble()).isEqualTo(0.3);
        assertThat(body.path("messages")).hasSize(1);
        assertThat(body.path("messages").get(0).path("content").asText()).isEqualTo("write a file");
        assertThat(lastApiKey.get()).isEqualTo("sk-test");
        assertThat(client.modelId()).isEqualTo("claude-sonnet-4-6");
    }

    @Test
    void complete_errorStatus_throwsWithStatusCode() {
        status = 529;
        reply  = "{\"type\": \"error\", \"error\": {\"type\": \"overloaded_error\"}}";

        assertThatThrownBy(() -> client.complete("x", 10, 0.0))
                .isInstanceOf(ClaudeApiException.class)
                .hasMessageContaining("overloaded_error")
                .extracting(e -> ((ClaudeApiException) e).statusCode())
                .isEqualTo(529);
    }

    @Test
    void complete_noTextBlock_throws() {
        reply = "{\"content\": [], \"stop_reason\": \"end_turn\"}";

        assertThatThrownBy(() -> client.complete("x", 10, 0.0))
                .isInstanceOf(ClaudeApiException.class)
                .hasMessageContaining("No text block");
    }
}
