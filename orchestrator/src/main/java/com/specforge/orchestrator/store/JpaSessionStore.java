package com.specforge.orchestrator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.specforge.orchestrator.model.*;
import com.specforge.orchestrator.repository.FileResultRepository;
import com.specforge.orchestrator.repository.GenerationSessionRepository;
import com.specforge.orchestrator.store.SessionSnapshot.FileSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Session store backed by PostgreSQL through Spring Data JPA.
 *
 * Every public method runs in its own transaction, so each state change is
 * committed before the caller moves on to the next stage.
 */
@Service
public class JpaSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(JpaSessionStore.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final GenerationSessionRepository sessionRepo;
    private final FileResultRepository        fileRepo;
    private final ObjectMapper                json;

    public JpaSessionStore(GenerationSessionRepository sessionRepo,
                           FileResultRepository fileRepo,
                           ObjectMapper objectMapper) {
        this.sessionRepo = sessionRepo;
        this.fileRepo    = fileRepo;
        this.json        = objectMapper;
    }

    // ------------------------------------------------------------------
    // Session lifecycle
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public UUID create(String specificationJson, String specificationRef,
                       TargetConfig target, PublishTarget publishTarget, String modelUsed) {
        GenerationSession session = sessionRepo.save(new GenerationSession(
                specificationJson, specificationRef, target, publishTarget, modelUsed));
        log.info("Created session {} (specRef={}, publish={})",
                session.getId(), specificationRef, publishTarget != null);
        return session.getId();
    }

    @Override
    @Transactional
    public boolean transition(UUID sessionId, SessionStatus from, SessionStatus to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalArgumentException("Illegal session transition " + from + " → " + to);
        }
        Instant now = Instant.now();
        int updated = to == SessionStatus.COMPLETED
                ? sessionRepo.completeIfIn(sessionId, from, now)
                : sessionRepo.compareAndSetStatus(sessionId, from, to, now);
        if (updated == 0) {
            log.warn("Session {} not in {}: transition to {} skipped", sessionId, from, to);
            return false;
        }
        log.info("Session {} {} → {}", sessionId, from, to);
        return true;
    }

    @Override
    @Transactional
    public boolean fail(UUID sessionId, String message) {
        int updated = sessionRepo.failIfActive(sessionId, message, Instant.now(),
                EnumSet.of(SessionStatus.COMPLETED, SessionStatus.FAILED));
        if (updated == 0) {
            log.warn("Session {} already terminal: failure '{}' not recorded", sessionId, message);
            return false;
        }
        log.error("Session {} → FAILED: {}", sessionId, message);
        return true;
    }

    @Override
    @Transactional
    public boolean recordManifest(UUID sessionId, Manifest manifest) {
        int updated = sessionRepo.setManifestIfIn(sessionId, SessionStatus.ANALYZING,
                toJson(manifest), Instant.now());
        if (updated == 0) {
            log.warn("Session {} no longer ANALYZING: manifest not recorded", sessionId);
            return false;
        }
        return true;
    }

    @Override
    @Transactional
    public boolean recordAggregate(UUID sessionId, int filesGenerated, List<String> warnings) {
        int updated = sessionRepo.setAggregateIfIn(sessionId, SessionStatus.AGGREGATING, filesGenerated,
                warnings.isEmpty() ? null : toJson(warnings), Instant.now());
        if (updated == 0) {
            log.warn("Session {} no longer AGGREGATING: aggregate not recorded", sessionId);
            return false;
        }
        return true;
    }

    // ------------------------------------------------------------------
    // File results (written by workers, one row per path)
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public void upsertFileResult(UUID sessionId, FileProgress progress) {
        FileResult row = fileRepo.findBySessionIdAndPath(sessionId, progress.path())
                .orElseGet(() -> new FileResult(
                        sessionRepo.getReferenceById(sessionId),
                        progress.entry(),
                        progress.position()));

        row.advanceTo(progress.state());
        row.setContent(progress.content());
        row.setAnalysisJson(progress.analysis() == null ? null : toJson(progress.analysis()));
        row.setAnalysisFallback(progress.analysisFallback());
        row.setFixApplied(progress.fixApplied());
        row.setFixOutcome(progress.fixOutcome());
        row.setPersisted(progress.persisted());
        row.setPublishOutcome(progress.publishOutcome());
        if (progress.publishRecord() != null) {
            row.setPublishRecord(progress.publishRecord());
        }
        row.setErrorLogJson(progress.errors().isEmpty() ? null : toJson(progress.errors()));
        fileRepo.save(row);
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Override
    @Transactional(readOnly = true)
    public Optional<SessionStatus> currentStatus(UUID sessionId) {
        return sessionRepo.findStatusById(sessionId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<SessionSnapshot> snapshot(UUID sessionId) {
        return sessionRepo.findById(sessionId).map(session -> new SessionSnapshot(
                session.getId(),
                session.getStatus(),
                session.getSpecificationRef(),
                session.getTargetConfig(),
                session.getPublishTarget(),
                session.getManifestJson() == null ? null
                        : fromJson(session.getManifestJson(), Manifest.class),
                fileRepo.findBySessionIdOrderByPositionAsc(sessionId).stream()
                        .map(this::toSnapshot)
                        .toList(),
                session.getErrorMessage(),
                session.getWarningsJson() == null ? List.of() : readStrings(session.getWarningsJson()),
                session.getModelUsed(),
                session.getFilesGenerated(),
                session.getCreatedAt(),
                session.getUpdatedAt(),
                session.getCompletedAt()));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private FileSnapshot toSnapshot(FileResult r) {
        return new FileSnapshot(
                r.getPath(),
                r.getCategory(),
                r.getPurpose(),
                r.getPosition(),
                r.getLanguage(),
                r.getState(),
                r.getContent(),
                r.getAnalysisJson() == null ? null
                        : fromJson(r.getAnalysisJson(), StaticAnalysisReport.class),
                r.isAnalysisFallback(),
                r.isFixApplied(),
                r.getFixOutcome(),
                r.isPersisted(),
                r.getPublishOutcome(),
                r.getPublishRecord(),
                r.getErrorLogJson() == null ? List.of() : readStrings(r.getErrorLogJson()));
    }

    private String toJson(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SessionStoreException("JSON serialization failed", e);
        }
    }

    private <T> T fromJson(String raw, Class<T> type) {
        try {
            return json.readValue(raw, type);
        } catch (JsonProcessingException e) {
            throw new SessionStoreException("Stored " + type.getSimpleName() + " is not valid JSON", e);
        }
    }

    private List<String> readStrings(String raw) {
        try {
            return json.readValue(raw, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new SessionStoreException("Stored message list is not valid JSON", e);
        }
    }
}
