package com.specforge.orchestrator.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.specforge.orchestrator.model.StaticAnalysisReport;
import com.specforge.orchestrator.model.StaticAnalysisReport.Issue;
import com.specforge.orchestrator.model.StaticAnalysisReport.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads a static-analysis reply into a {@link StaticAnalysisReport}.
 *
 * Accepts camelCase and snake_case keys and the severity words analysis
 * tools commonly use. Returns empty when the JSON has no recognisable
 * report fields, so the caller can fall back to the default report.
 */
final class AnalysisReportReader {

    private AnalysisReportReader() {}

    static Optional<StaticAnalysisReport> read(JsonNode root) {
        if (root == null || !root.isObject()) return Optional.empty();

        JsonNode score  = field(root, "qualityScore", "quality_score", "score");
        JsonNode issues = field(root, "issues");
        if (score.isMissingNode() && issues.isMissingNode()) return Optional.empty();
        if (!issues.isMissingNode() && !issues.isArray()) return Optional.empty();

        List<Issue> parsed = new ArrayList<>();
        for (JsonNode i : issues) {
            if (i.isTextual()) {
                parsed.add(new Issue(Severity.MEDIUM, "", i.asText(), null));
            } else if (i.isObject()) {
                JsonNode suggestion = field(i, "suggestion", "fix");
                parsed.add(new Issue(
                        severity(i.path("severity").asText("")),
                        field(i, "location", "line").asText(""),
                        field(i, "message", "description").asText(""),
                        suggestion.isMissingNode() || suggestion.isNull() ? null : suggestion.asText()));
            }
        }

        List<String> recommendations = new ArrayList<>();
        for (JsonNode r : field(root, "recommendations")) {
            if (!r.asText("").isBlank()) recommendations.add(r.asText());
        }

        int qualityScore = score.isNumber() || score.isTextual()
                ? score.asInt(StaticAnalysisReport.FALLBACK_SCORE)
                : StaticAnalysisReport.FALLBACK_SCORE;
        return Optional.of(new StaticAnalysisReport(qualityScore, parsed, recommendations));
    }

    static Severity severity(String raw) {
        return switch (raw.strip().toLowerCase(Locale.ROOT)) {
            case "high", "critical", "error", "blocker"  -> Severity.HIGH;
            case "low", "info", "minor", "style", "hint" -> Severity.LOW;
            default                                       -> Severity.MEDIUM;
        };
    }

    private static JsonNode field(JsonNode node, String... names) {
        for (String name : names) {
            if (node.has(name)) return node.get(name);
        }
        return node.path(names[0]);
    }
}
