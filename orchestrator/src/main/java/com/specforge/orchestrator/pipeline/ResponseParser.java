package com.specforge.orchestrator.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw completion text into something the pipeline can use:
 *   1. JSON documents: manifest and static-analysis replies
 *   2. Source code: generation and fix replies, minus any Markdown fence
 *
 * Models are asked for bare JSON or bare code, but often wrap the answer in a
 * fence or surround it with prose. Parsing is lenient in the ways that are
 * cheap to get right and strict everywhere else.
 */
public final class ResponseParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    // First fenced block anywhere in the text: ```json ... ``` or ``` ... ```
    private static final Pattern ANY_FENCE = Pattern.compile(
            "```[\\w.+-]*[ \\t]*\\r?\\n(.*?)\\r?\\n?```",
            Pattern.DOTALL
    );

    // A reply that is nothing but one fenced block (inner fences allowed).
    private static final Pattern WHOLE_FENCE = Pattern.compile(
            "\\A\\s*```[\\w.+-]*[ \\t]*\\r?\\n(.*)\\r?\\n?```\\s*\\z",
            Pattern.DOTALL
    );

    private ResponseParser() {}

    /**
     * Parse the reply as a JSON object or array.
     *
     * Tries the whole text first, then the content of the first fenced block.
     * Scalars ("42", "true") do not count as a document.
     */
    public static Optional<JsonNode> parseJson(String response) {
        if (response == null || response.isBlank()) return Optional.empty();
        Optional<JsonNode> direct = readDocument(response.strip());
        if (direct.isPresent()) return direct;

        Matcher m = ANY_FENCE.matcher(response);
        return m.find() ? readDocument(m.group(1).strip()) : Optional.empty();
    }

    /**
     * Primary parse, then the recovery parse on the largest balanced fragment.
     * Empty only when both fail.
     */
    public static Optional<JsonNode> parseJsonLeniently(String response) {
        Optional<JsonNode> primary = parseJson(response);
        if (primary.isPresent()) return primary;
        return largestBalancedFragment(response).flatMap(ResponseParser::readDocument);
    }

    /**
     * The longest substring that starts with '{' or '[' and closes every
     * bracket it opens, ignoring brackets inside JSON strings. Fragments
     * nested inside an unclosed outer bracket still count.
     */
    public static Optional<String> largestBalancedFragment(String text) {
        if (text == null) return Optional.empty();

        String best = null;
        Deque<Character> expected = new ArrayDeque<>();
        int start = -1;
        boolean inString = false;
        boolean escaped  = false;

        for (int i = 0; ; i++) {
            if (i == text.length()) {
                if (expected.isEmpty()) break;
                // Candidate never closed (e.g. a truncated reply): rescan inside it.
                expected.clear();
                i = start;
                continue;
            }
            char c = text.charAt(i);

            if (expected.isEmpty()) {
                if (c == '{' || c == '[') {
                    start = i;
                    expected.push(c == '{' ? '}' : ']');
                    inString = false;
                    escaped  = false;
                }
                continue;
            }

            if (inString) {
                if (escaped)          escaped = false;
                else if (c == '\\')   escaped = true;
                else if (c == '"')    inString = false;
                continue;
            }

            switch (c) {
                case '"' -> inString = true;
                case '{' -> expected.push('}');
                case '[' -> expected.push(']');
                case '}', ']' -> {
                    if (expected.peek() != c) {
                        // Mismatched closer: abandon this candidate and rescan after its start.
                        expected.clear();
                        i = start;
                        continue;
                    }
                    expected.pop();
                    if (expected.isEmpty()) {
                        String candidate = text.substring(start, i + 1);
                        if (best == null || candidate.length() > best.length()) best = candidate;
                    }
                }
                default -> { }
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Source code from a generation or fix reply.
     *
     * If the whole reply is a single fenced block, the fence is removed.
     * Anything else is returned as-is (minus surrounding blank lines), so a
     * generated Markdown file keeps its own fences.
     */
    public static String extractCode(String response) {
        if (response == null) return "";
        Matcher m = WHOLE_FENCE.matcher(response);
        String code = m.matches() ? m.group(1) : response;
        return code.strip().isEmpty() ? "" : stripBlankEdges(code);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Optional<JsonNode> readDocument(String text) {
        try {
            JsonNode node = MAPPER.readTree(text);
            return node != null && (node.isObject() || node.isArray())
                    ? Optional.of(node)
                    : Optional.empty();
        } catch (Exception e) {
            return Optional.empty();
        }
    }

    private static String stripBlankEdges(String code) {
        String s = code.replaceFirst("\\A(?:[ \\t]*\\r?\\n)+", "");
        s = s.stripTrailing();
        return s + "\n";
    }
}
