package com.specforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Structured static-analysis verdict for one generated file.
 *
 * qualityScore is clamped to 0..100. An empty issue list never triggers a
 * fix attempt, whatever the score.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StaticAnalysisReport(int qualityScore,
                                   List<Issue> issues,
                                   List<String> recommendations) {

    /** Score used when the analysis output cannot be read. */
    public static final int FALLBACK_SCORE = 70;

    public enum Severity { HIGH, MEDIUM, LOW }

    public enum Grade { GOOD, FAIR, POOR }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Issue(Severity severity, String location, String message, String suggestion) {}

    public StaticAnalysisReport {
        qualityScore    = Math.max(0, Math.min(100, qualityScore));
        issues          = issues == null ? List.of() : List.copyOf(issues);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    /** Default report substituted when the analysis response is unusable. */
    public static StaticAnalysisReport fallback(String reason) {
        return new StaticAnalysisReport(FALLBACK_SCORE, List.of(),
                List.of("Static analysis output could not be parsed: " + reason));
    }

    @JsonIgnore
    public boolean hasIssues() {
        return !issues.isEmpty();
    }

    /** Same bands the review screen colours scores by. */
    @JsonIgnore
    public Grade grade() {
        if (qualityScore >= 80) return Grade.GOOD;
        if (qualityScore >= 60) return Grade.FAIR;
        return Grade.POOR;
    }
}
