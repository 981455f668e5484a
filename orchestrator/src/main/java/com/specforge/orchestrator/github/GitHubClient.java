package com.specforge.orchestrator.github;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * HTTP client for the GitHub contents API.
 *
 * A write is two calls: GET the current blob sha (GitHub requires it to
 * overwrite an existing file), then PUT the new content. Uses
 * java.net.http.HttpClient like the Claude client, so every header on the
 * wire is explicit.
 *
 * Called from worker threads; blocking I/O is fine here.
 */
@Component
public class GitHubClient implements SourceControlClient {

    private static final Logger log = LoggerFactory.getLogger(GitHubClient.class);

    private static final String API_VERSION = "2022-11-28";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       token;

    public GitHubClient(@Value("${specforge.github.base-url:https://api.github.com}") String baseUrl,
                        @Value("${specforge.github.token:}") String token,
                        ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.token   = token;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------

    @Override
    public PutFileResult putFile(String owner, String repository, String path,
                                 String content, String branch, String message) {
        String url = contentsUrl(owner, repository, path);
        String opName = "putFile %s/%s:%s@%s".formatted(owner, repository, path, branch);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", message);
        body.put("content", Base64.getEncoder().encodeToString(content.getBytes(StandardCharsets.UTF_8)));
        body.put("branch",  branch);
        String existingSha = existingSha(url, branch, opName);
        if (existingSha != null) {
            body.put("sha", existingSha);
        }

        HttpResponse<String> resp = send(request(url)
                .PUT(HttpRequest.BodyPublishers.ofString(toJson(body)))
                .header("Content-Type", "application/json")
                .build(), opName);
        if (resp.statusCode() != 200 && resp.statusCode() != 201) {
            throw new SourceControlException(
                    opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
        }

        try {
            JsonNode root = json.readTree(resp.body());
            String sha     = root.path("commit").path("sha").asText(null);
            String htmlUrl = root.path("content").path("html_url").asText(null);
            if (sha == null) {
                throw new SourceControlException(opName + " returned no commit sha");
            }
            log.info("Committed {} to {}/{}@{} ({})", path, owner, repository, branch, sha);
            return new PutFileResult(sha, htmlUrl);
        } catch (JsonProcessingException e) {
            throw new SourceControlException("Failed to parse " + opName + " response", e);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    /** Blob sha of the file on the branch, or null if it does not exist yet. */
    private String existingSha(String url, String branch, String opName) {
        HttpResponse<String> resp = send(request(url + "?ref=" + encode(branch)).GET().build(), opName);
        if (resp.statusCode() == 404) return null;
        if (resp.statusCode() != 200) {
            throw new SourceControlException(
                    opName + " lookup failed: HTTP " + resp.statusCode() + ": " + resp.body());
        }
        try {
            return json.readTree(resp.body()).path("sha").asText(null);
        } catch (JsonProcessingException e) {
            throw new SourceControlException("Failed to parse " + opName + " lookup response", e);
        }
    }

    private HttpRequest.Builder request(String url) {
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(30))
                .header("Accept", "application/vnd.github+json")
                .header("X-GitHub-Api-Version", API_VERSION);
        if (token != null && !token.isBlank()) {
            b.header("Authorization", "Bearer " + token);
        }
        return b;
    }

    private HttpResponse<String> send(HttpRequest req, String opName) {
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceControlException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new SourceControlException(opName + " failed", e);
        }
    }

    private String contentsUrl(String owner, String repository, String path) {
        // Encode each path segment but keep the slashes.
        String encodedPath = Arrays.stream(path.split("/"))
                .filter(s -> !s.isEmpty())
                .map(GitHubClient::encode)
                .collect(Collectors.joining("/"));
        return baseUrl + "/repos/" + encode(owner) + "/" + encode(repository) + "/contents/" + encodedPath;
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new SourceControlException("JSON serialization failed", e);
        }
    }
}
