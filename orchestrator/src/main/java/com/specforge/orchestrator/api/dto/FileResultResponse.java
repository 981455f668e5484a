package com.specforge.orchestrator.api.dto;

import com.specforge.orchestrator.model.FileState;
import com.specforge.orchestrator.model.FixOutcome;
import com.specforge.orchestrator.model.PublishOutcome;
import com.specforge.orchestrator.model.StaticAnalysisReport;
import com.specforge.orchestrator.store.SessionSnapshot.FileSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * One generated file as seen by a status poll.
 *
 * stages tells per stage whether it succeeded, so a caller does not have to
 * reconstruct it from state and outcome fields.
 */
public record FileResultResponse(
        String               path,
        String               category,
        String               purpose,
        String               language,
        String               state,
        String               content,
        StaticAnalysisReport analysis,
        String               qualityGrade,
        boolean              fixApplied,
        String               fixOutcome,
        String               publishOutcome,
        String               publishRevision,
        String               publishUrl,
        Instant              publishedAt,
        Stages               stages,
        List<String>         errors
) {

    /**
     * Values: "succeeded", "failed", "fallback" (analysis only),
     * "skipped", "not_required" (fix only) or "pending".
     */
    public record Stages(String generation, String analysis, String fix,
                         String persistence, String publish) {}

    public static FileResultResponse from(FileSnapshot f) {
        return new FileResultResponse(
                f.path(),
                f.category().jsonKey(),
                f.purpose(),
                f.language(),
                f.state().name(),
                f.content(),
                f.analysis(),
                f.analysis() == null ? null : f.analysis().grade().name(),
                f.fixApplied(),
                f.fixOutcome() == null ? null : f.fixOutcome().name(),
                f.publishOutcome() == null ? null : f.publishOutcome().name(),
                f.publishRecord() == null ? null : f.publishRecord().revisionId(),
                f.publishRecord() == null ? null : f.publishRecord().url(),
                f.publishRecord() == null ? null : f.publishRecord().publishedAt(),
                stagesOf(f),
                f.errors());
    }

    private static Stages stagesOf(FileSnapshot f) {
        boolean errored   = f.state() == FileState.ERRORED;
        boolean generated = f.content() != null && !f.content().isBlank();
        // Stages an errored file never reached are skipped, not failed.
        String notReached = errored ? "skipped" : "pending";

        String generation = generated ? "succeeded" : errored ? "failed" : "pending";

        String analysis = f.analysis() == null ? notReached
                : f.analysisFallback() ? "fallback" : "succeeded";

        String fix = f.fixOutcome() == null ? notReached : switch (f.fixOutcome()) {
            case NOT_REQUIRED -> "not_required";
            case APPLIED      -> "succeeded";
            case FAILED       -> "failed";
        };

        String persistence = f.persisted() ? "succeeded"
                : errored && generated ? "failed" : notReached;

        String publish = f.publishOutcome() == null ? notReached : switch (f.publishOutcome()) {
            case SKIPPED   -> "skipped";
            case PUBLISHED -> "succeeded";
            case FAILED    -> "failed";
        };
        return new Stages(generation, analysis, fix, persistence, publish);
    }
}
