package com.specforge.orchestrator.claude;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.specforge.orchestrator.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Anthropic Messages API.
 *
 * Each call is a single user turn; the pipeline never needs conversation
 * history. Errors are not retried here: a failed call surfaces to the
 * caller, which decides whether it fails a file or the whole session.
 */
@Component
public class ClaudeClient implements CompletionClient {

    private static final Logger log = LoggerFactory.getLogger(ClaudeClient.class);

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /** A single message in a conversation. */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content, String stop_reason) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Extracts the text from the first text block. */
        public String firstText() {
            if (content == null) {
                throw new IllegalStateException("No content in response");
            }
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No text block in response"));
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_VER = "2023-06-01";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       apiUrl;
    private final String       model;
    private final Duration     requestTimeout;

    public ClaudeClient(@Value("${anthropic.api-key}") String apiKey,
                        @Value("${anthropic.base-url:https://api.anthropic.com}") String baseUrl,
                        PipelineProperties properties,
                        ObjectMapper objectMapper) {
        this.apiKey         = apiKey;
        this.apiUrl         = baseUrl + "/v1/messages";
        this.model          = properties.model();
        this.requestTimeout = properties.completionTimeout();
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    @Override
    public String complete(String prompt, int maxOutputTokens, double temperature) {
        try {
            String requestBody = json.writeValueAsString(Map.of(
                    "model",       model,
                    "max_tokens",  maxOutputTokens,
                    "temperature", temperature,
                    "messages",    List.of(new Message("user", prompt))
            ));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl))
                    .timeout(requestTimeout)
                    .header("content-type",      "application/json")
                    .header("x-api-key",         apiKey)
                    .header("anthropic-version", API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                throw new ClaudeApiException(response.statusCode(), response.body());
            }

            MessagesResponse parsed = json.readValue(response.body(), MessagesResponse.class);
            if ("max_tokens".equals(parsed.stop_reason())) {
                log.warn("Completion truncated at {} output tokens", maxOutputTokens);
            }
            return parsed.firstText();

        } catch (ClaudeApiException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClaudeApiException("Claude API call interrupted", e);
        } catch (Exception e) {
            throw new ClaudeApiException("Claude API call failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String modelId() {
        return model;
    }

    // -------------------------------------------------------------------------
    // Exception type
    // -------------------------------------------------------------------------

    public static class ClaudeApiException extends RuntimeException {
        private final int statusCode;

        public ClaudeApiException(int statusCode, String body) {
            super("Claude API error %d: %s".formatted(statusCode, body));
            this.statusCode = statusCode;
        }

        public ClaudeApiException(String message, Throwable cause) {
            super(message, cause);
            this.statusCode = -1;
        }

        /** HTTP status, or -1 when the request never got a response. */
        public int statusCode() { return statusCode; }
    }
}
