package com.specforge.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.specforge.orchestrator.claude.CompletionClient;
import com.specforge.orchestrator.events.SessionEvent;
import com.specforge.orchestrator.events.SessionEventBus;
import com.specforge.orchestrator.model.Manifest;
import com.specforge.orchestrator.model.PublishTarget;
import com.specforge.orchestrator.model.SessionStatus;
import com.specforge.orchestrator.model.TargetConfig;
import com.specforge.orchestrator.pipeline.*;
import com.specforge.orchestrator.store.SessionSnapshot;
import com.specforge.orchestrator.store.SessionStore;
import com.specforge.orchestrator.store.SpecificationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Entry point for generation sessions and owner of the session state machine:
 *
 *   PENDING → ANALYZING → GENERATING → AGGREGATING → COMPLETED
 *      └──────────┴────────────┴─────────────┴──────→ FAILED
 *
 * {@link #start} returns as soon as the PENDING row is committed; the rest
 * of the run happens on the session executor. Each transition is a
 * compare-and-set on the stored status, so a run whose session was
 * cancelled (set to FAILED) notices at its next transition and stops.
 *
 * This is the only class that changes the session row. Workers only write
 * their own FileResult rows.
 */
@Service
public class SessionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SessionOrchestrator.class);

    static final String CANCELLED_MESSAGE = "Cancelled by caller";

    /**
     * Everything needed to start a session. The inline specification wins
     * over the reference when both are given.
     */
    public record StartCommand(String specificationRef,
                               JsonNode specification,
                               TargetConfig target,
                               PublishTarget publishTarget) {
        public StartCommand {
            if (target == null) target = TargetConfig.unspecified();
        }
    }

    private final SessionStore          store;
    private final SpecificationStore    specifications;
    private final ManifestAnalyzer      manifestAnalyzer;
    private final GenerationCoordinator coordinator;
    private final CompletionClient      completion;
    private final SessionEventBus       events;
    private final PipelineMetrics       metrics;
    private final ObjectMapper          json;
    private final Executor              sessionExecutor;

    public SessionOrchestrator(SessionStore store,
                               SpecificationStore specifications,
                               ManifestAnalyzer manifestAnalyzer,
                               GenerationCoordinator coordinator,
                               CompletionClient completion,
                               SessionEventBus events,
                               PipelineMetrics metrics,
                               ObjectMapper objectMapper,
                               @Qualifier("sessionExecutor") Executor sessionExecutor) {
        this.store            = store;
        this.specifications   = specifications;
        this.manifestAnalyzer = manifestAnalyzer;
        this.coordinator      = coordinator;
        this.completion       = completion;
        this.events           = events;
        this.metrics          = metrics;
        this.json             = objectMapper;
        this.sessionExecutor  = sessionExecutor;
    }

    // ------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------

    /**
     * Create a PENDING session and schedule its run.
     *
     * @throws PipelineException SPECIFICATION_MISSING if no specification could be
     *                           resolved; no session is created in that case
     */
    public UUID start(StartCommand command) {
        JsonNode specification = resolveSpecification(command);

        UUID sessionId = store.create(toJson(specification), command.specificationRef(),
                command.target(), command.publishTarget(), completion.modelId());
        events.publish(SessionEvent.of(sessionId, SessionStatus.PENDING, "Session created"));
        log.info("Session {} accepted ({}, publish={})", sessionId,
                command.target().describe().replace('\n', ' '), command.publishTarget() != null);

        sessionExecutor.execute(() -> run(sessionId, specification,
                command.target(), command.publishTarget()));
        return sessionId;
    }

    /** Persisted view of the session; never waits on an in-flight run. */
    public Optional<SessionSnapshot> status(UUID sessionId) {
        return store.snapshot(sessionId);
    }

    /**
     * Move a running session to FAILED. Workers see it before their next
     * stage transition.
     *
     * @return false if the session is unknown or already terminal
     */
    public boolean cancel(UUID sessionId) {
        boolean cancelled = store.fail(sessionId, CANCELLED_MESSAGE);
        if (cancelled) {
            log.info("Session {} cancelled", sessionId);
            events.publish(SessionEvent.of(sessionId, SessionStatus.FAILED, CANCELLED_MESSAGE));
        }
        return cancelled;
    }

    // ------------------------------------------------------------------
    // Session run (session executor thread)
    // ------------------------------------------------------------------

    void run(UUID sessionId, JsonNode specification, TargetConfig target, PublishTarget publishTarget) {
        MdcContext.setSession(sessionId);
        try {
            if (!advance(sessionId, SessionStatus.PENDING, SessionStatus.ANALYZING,
                    "Analyzing specification")) return;

            Manifest manifest = manifestAnalyzer.analyze(specification, target);
            if (!store.recordManifest(sessionId, manifest)) {
                log.info("Session {} left ANALYZING before its manifest was stored, run stops", sessionId);
                return;
            }

            if (!advance(sessionId, SessionStatus.ANALYZING, SessionStatus.GENERATING,
                    "Generating " + manifest.size() + " files")) return;

            AggregateResult result = coordinator.run(
                    new WorkerContext(sessionId, specification, target, manifest, publishTarget));

            if (result.allErrored()) {
                failSession(sessionId, PipelineException.Kind.ALL_FILES_FAILED
                        + ": all " + result.outcomes().size() + " files failed to generate");
                return;
            }

            if (!advance(sessionId, SessionStatus.GENERATING, SessionStatus.AGGREGATING,
                    result.succeeded() + " of " + result.outcomes().size() + " files done")) return;

            if (!store.recordAggregate(sessionId, result.succeeded(), result.warnings())) {
                log.info("Session {} left AGGREGATING before its summary was stored, run stops", sessionId);
                return;
            }

            if (!advance(sessionId, SessionStatus.AGGREGATING, SessionStatus.COMPLETED,
                    result.succeeded() + " files generated, " + result.warnings().size() + " warnings")) return;
            metrics.recordSession(true);

        } catch (PipelineException e) {
            log.error("Session {} failed ({}): {}", sessionId, e.getKind(), e.getMessage());
            failSession(sessionId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Session {} failed unexpectedly", sessionId, e);
            failSession(sessionId, e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** False means the session left {@code from} under us, i.e. it was cancelled. */
    private boolean advance(UUID sessionId, SessionStatus from, SessionStatus to, String summary) {
        if (!store.transition(sessionId, from, to)) {
            log.info("Session {} no longer {}, run stops", sessionId, from);
            return false;
        }
        events.publish(SessionEvent.of(sessionId, to, summary));
        return true;
    }

    private void failSession(UUID sessionId, String message) {
        try {
            if (store.fail(sessionId, message)) {
                events.publish(SessionEvent.of(sessionId, SessionStatus.FAILED, message));
                metrics.recordSession(false);
            }
        } catch (RuntimeException e) {
            log.error("Could not record failure of session {}: {}", sessionId, e.getMessage(), e);
        }
    }

    private JsonNode resolveSpecification(StartCommand command) {
        if (isUsable(command.specification())) {
            return command.specification();
        }
        String ref = command.specificationRef();
        if (ref != null && !ref.isBlank()) {
            Optional<JsonNode> stored = specifications.find(ref);
            if (stored.isPresent()) return stored.get();
            throw new PipelineException(PipelineException.Kind.SPECIFICATION_MISSING,
                    "Specification not found: " + ref);
        }
        throw new PipelineException(PipelineException.Kind.SPECIFICATION_MISSING,
                "No specification or specification reference given");
    }

    private static boolean isUsable(JsonNode node) {
        return node != null && node.isContainerNode() && !node.isEmpty();
    }

    private String toJson(JsonNode node) {
        try {
            return json.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Specification cannot be serialized", e);
        }
    }
}
