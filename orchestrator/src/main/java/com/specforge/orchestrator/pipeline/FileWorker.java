package com.specforge.orchestrator.pipeline;

import com.specforge.orchestrator.claude.CompletionClient;
import com.specforge.orchestrator.config.PipelineProperties;
import com.specforge.orchestrator.github.SourceControlClient;
import com.specforge.orchestrator.github.SourceControlClient.PutFileResult;
import com.specforge.orchestrator.model.*;
import com.specforge.orchestrator.store.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * The per-file pipeline:
 *
 *   GENERATING → ANALYZING → [FIXING] → PERSISTING → [PUBLISHING] → DONE
 *
 * Stages run strictly in sequence on the calling thread. Every transition is
 * written to the session store before the next stage starts, and before
 * each transition the worker checks whether its session has been cancelled;
 * if so it stops without writing anything further.
 *
 * Only generation failures (and store failures) make a file ERRORED.
 * Analysis, fix and publish problems are absorbed and recorded on the file.
 */
@Component
public class FileWorker {

    private static final Logger log = LoggerFactory.getLogger(FileWorker.class);

    private final CompletionClient    completion;
    private final SourceControlClient sourceControl;
    private final SessionStore        store;
    private final PromptTemplates     prompts;
    private final PipelineMetrics     metrics;
    private final PipelineProperties  props;

    public FileWorker(CompletionClient completion,
                      SourceControlClient sourceControl,
                      SessionStore store,
                      PromptTemplates prompts,
                      PipelineMetrics metrics,
                      PipelineProperties props) {
        this.completion    = completion;
        this.sourceControl = sourceControl;
        this.store         = store;
        this.prompts       = prompts;
        this.metrics       = metrics;
        this.props         = props;
    }

    /** Commit message used for every published file; depends only on the path. */
    public static String commitMessage(String path) {
        return "Add generated file " + path;
    }

    // ------------------------------------------------------------------
    // Entry point: called by GenerationCoordinator on a pool thread
    // ------------------------------------------------------------------

    public FileOutcome process(WorkerContext ctx, ManifestEntry entry, int position) {
        MdcContext.setFile(ctx.sessionId(), entry.path());
        FileProgress file = new FileProgress(entry, position);
        String language = LanguageDetector.detect(entry.path());
        try {
            log.info("Worker started for {} ({})", entry.path(), entry.category());

            if (cancelled(ctx)) return FileOutcome.of(file, true);
            store.upsertFileResult(ctx.sessionId(), file);

            // 1. GENERATING
            String content;
            try {
                content = metrics.timeStage("generate", () -> ResponseParser.extractCode(
                        completion.complete(
                                prompts.generate(ctx.specification(), ctx.target(), ctx.manifest(), entry, language),
                                props.generation().maxTokens(),
                                props.generation().temperature())));
            } catch (RuntimeException e) {
                return errored(ctx, file, "Generation failed: " + e.getMessage());
            }
            if (content.isBlank()) {
                return errored(ctx, file, PipelineException.Kind.EMPTY_GENERATION
                        + ": completion returned no content for " + entry.path());
            }
            file.setContent(content);

            // 2. ANALYZING
            if (!advance(ctx, file, FileState.ANALYZING)) return FileOutcome.of(file, true);
            analyze(file, language);

            // 3. FIXING: exactly one attempt, only when issues were found
            if (file.analysis().hasIssues()) {
                if (!advance(ctx, file, FileState.FIXING)) return FileOutcome.of(file, true);
                fixOnce(file, language);
            } else {
                file.setFixOutcome(FixOutcome.NOT_REQUIRED);
            }

            // 4. PERSISTING
            if (cancelled(ctx)) return FileOutcome.of(file, true);
            file.advanceTo(FileState.PERSISTING);
            file.setPersisted(true);
            store.upsertFileResult(ctx.sessionId(), file);

            // 5. PUBLISHING: best effort, never fails the file
            PublishTarget target = ctx.publishTarget();
            if (target != null) {
                if (!advance(ctx, file, FileState.PUBLISHING)) return FileOutcome.of(file, true);
                publish(file, target);
            } else {
                file.setPublishOutcome(PublishOutcome.SKIPPED);
            }

            // 6. DONE
            if (cancelled(ctx)) return FileOutcome.of(file, true);
            file.advanceTo(FileState.DONE);
            store.upsertFileResult(ctx.sessionId(), file);
            log.info("Worker done for {} (fix={}, publish={})",
                    entry.path(), file.fixOutcome(), file.publishOutcome());
            FileOutcome outcome = FileOutcome.of(file, false);
            metrics.recordFile(outcome);
            return outcome;

        } catch (RuntimeException e) {
            // Store or other unexpected failure mid-pipeline.
            log.error("Worker for {} failed in {}: {}", entry.path(), file.state(), e.getMessage(), e);
            return errored(ctx, file, "Failed during " + file.state() + ": " + e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }

    // ------------------------------------------------------------------
    // Stages
    // ------------------------------------------------------------------

    /** Always leaves a report on the file: the parsed one or the fallback. */
    private void analyze(FileProgress file, String language) {
        try {
            String raw = metrics.timeStage("analyze", () -> completion.complete(
                    prompts.analyze(file.entry(), language, file.content()),
                    props.analysis().maxTokens(),
                    props.analysis().temperature()));
            Optional<StaticAnalysisReport> report = ResponseParser.parseJsonLeniently(raw)
                    .flatMap(AnalysisReportReader::read);
            if (report.isPresent()) {
                file.setAnalysis(report.get(), false);
                log.info("Analysis of {}: score={} issues={}",
                        file.path(), report.get().qualityScore(), report.get().issues().size());
            } else {
                log.warn("Analysis reply for {} is not a report, using default", file.path());
                file.setAnalysis(StaticAnalysisReport.fallback("reply was not a JSON report"), true);
            }
        } catch (RuntimeException e) {
            log.warn("Analysis call for {} failed, using default report: {}", file.path(), e.getMessage());
            file.setAnalysis(StaticAnalysisReport.fallback("analysis call failed"), true);
        }
    }

    private void fixOnce(FileProgress file, String language) {
        try {
            String fixed = metrics.timeStage("fix", () -> ResponseParser.extractCode(completion.complete(
                    prompts.fix(file.entry(), language, file.content(), file.analysis().issues()),
                    props.fix().maxTokens(),
                    props.fix().temperature())));
            if (fixed.isBlank()) {
                file.setFixOutcome(FixOutcome.FAILED);
                file.addError("Fix returned no content; original content kept");
                log.warn("Fix for {} returned no content", file.path());
                return;
            }
            file.setContent(fixed);
            file.setFixOutcome(FixOutcome.APPLIED);
            log.info("Fix applied to {} ({} issues)", file.path(), file.analysis().issues().size());
        } catch (RuntimeException e) {
            file.setFixOutcome(FixOutcome.FAILED);
            file.addError("Fix failed: " + e.getMessage());
            log.warn("Fix for {} failed, keeping original content: {}", file.path(), e.getMessage());
        }
    }

    private void publish(FileProgress file, PublishTarget target) {
        try {
            PutFileResult result = metrics.timeStage("publish", () -> sourceControl.putFile(
                    target.owner(), target.repository(), file.path(),
                    file.content(), target.branch(), commitMessage(file.path())));
            file.setPublishRecord(new PublishRecord(result.revisionId(), result.url(), Instant.now()));
            file.setPublishOutcome(PublishOutcome.PUBLISHED);
        } catch (RuntimeException e) {
            file.setPublishOutcome(PublishOutcome.FAILED);
            file.addError("Publish failed: " + e.getMessage());
            log.warn("Publishing {} to {}/{}@{} failed: {}",
                    file.path(), target.owner(), target.repository(), target.branch(), e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Check for cancellation, then move forward and persist. False if cancelled. */
    private boolean advance(WorkerContext ctx, FileProgress file, FileState next) {
        if (cancelled(ctx)) return false;
        file.advanceTo(next);
        store.upsertFileResult(ctx.sessionId(), file);
        return true;
    }

    private boolean cancelled(WorkerContext ctx) {
        boolean failed = store.currentStatus(ctx.sessionId())
                .map(s -> s == SessionStatus.FAILED)
                .orElse(true);
        if (failed) {
            log.info("Session {} is no longer running, worker stops", ctx.sessionId());
        }
        return failed;
    }

    private FileOutcome errored(WorkerContext ctx, FileProgress file, String message) {
        file.addError(message);
        file.advanceTo(FileState.ERRORED);
        log.error("File {} errored: {}", file.path(), message);
        try {
            if (!cancelled(ctx)) {
                store.upsertFileResult(ctx.sessionId(), file);
            }
        } catch (RuntimeException e) {
            log.error("Could not record error state for {}: {}", file.path(), e.getMessage());
        }
        FileOutcome outcome = FileOutcome.of(file, false);
        metrics.recordFile(outcome);
        return outcome;
    }
}
