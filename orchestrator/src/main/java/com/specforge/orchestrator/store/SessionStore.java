package com.specforge.orchestrator.store;

import com.specforge.orchestrator.model.FileProgress;
import com.specforge.orchestrator.model.Manifest;
import com.specforge.orchestrator.model.PublishTarget;
import com.specforge.orchestrator.model.SessionStatus;
import com.specforge.orchestrator.model.TargetConfig;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable home of session and per-file state. The single source of truth
 * for status polling.
 *
 * Status changes are compare-and-set: {@link #transition} and {@link #fail}
 * return false when the session is no longer in a state that allows the
 * move, which is how a cancelled run notices it has been cancelled.
 */
public interface SessionStore {

    /** Persist a new PENDING session and return its id. */
    UUID create(String specificationJson, String specificationRef,
                TargetConfig target, PublishTarget publishTarget, String modelUsed);

    /** Atomically move {@code from → to}. False if the session is not in {@code from}. */
    boolean transition(UUID sessionId, SessionStatus from, SessionStatus to);

    /** Move any non-terminal session to FAILED. False if it was already terminal. */
    boolean fail(UUID sessionId, String message);

    /** Store the manifest. False, and nothing written, unless the session is ANALYZING. */
    boolean recordManifest(UUID sessionId, Manifest manifest);

    /** Insert or replace the FileResult keyed by (sessionId, path). */
    void upsertFileResult(UUID sessionId, FileProgress progress);

    /** Record the fan-in summary. False, and nothing written, unless the session is AGGREGATING. */
    boolean recordAggregate(UUID sessionId, int filesGenerated, List<String> warnings);

    Optional<SessionStatus> currentStatus(UUID sessionId);

    Optional<SessionSnapshot> snapshot(UUID sessionId);
}
