package com.specforge.orchestrator.repository;

import com.specforge.orchestrator.model.GenerationSession;
import com.specforge.orchestrator.model.SessionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + status transitions for the generation_sessions table.
 */
public interface GenerationSessionRepository extends JpaRepository<GenerationSession, UUID> {

    /**
     * Compare-and-set on the status column.
     *
     * The WHERE clause carries the expected current status, so a session that
     * was cancelled (moved to FAILED) in the meantime is left untouched and
     * the caller sees 0 updated rows.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE GenerationSession s
            SET s.status = :to, s.updatedAt = :now
            WHERE s.id = :id AND s.status = :from
            """)
    int compareAndSetStatus(@Param("id") UUID id,
                            @Param("from") SessionStatus from,
                            @Param("to") SessionStatus to,
                            @Param("now") Instant now);

    /** AGGREGATING → COMPLETED together with the completion stamp. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE GenerationSession s
            SET s.status = com.specforge.orchestrator.model.SessionStatus.COMPLETED,
                s.completedAt = :now,
                s.updatedAt = :now
            WHERE s.id = :id AND s.status = :from
            """)
    int completeIfIn(@Param("id") UUID id,
                     @Param("from") SessionStatus from,
                     @Param("now") Instant now);

    /**
     * Column-level writes guarded by the expected status. They never touch
     * the status column, so a concurrent failure cannot be overwritten.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE GenerationSession s
            SET s.manifestJson = :manifest, s.updatedAt = :now
            WHERE s.id = :id AND s.status = :expected
            """)
    int setManifestIfIn(@Param("id") UUID id,
                        @Param("expected") SessionStatus expected,
                        @Param("manifest") String manifestJson,
                        @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE GenerationSession s
            SET s.filesGenerated = :filesGenerated, s.warningsJson = :warnings, s.updatedAt = :now
            WHERE s.id = :id AND s.status = :expected
            """)
    int setAggregateIfIn(@Param("id") UUID id,
                         @Param("expected") SessionStatus expected,
                         @Param("filesGenerated") int filesGenerated,
                         @Param("warnings") String warningsJson,
                         @Param("now") Instant now);

    /** Move any non-terminal session to FAILED, recording why. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE GenerationSession s
            SET s.status = com.specforge.orchestrator.model.SessionStatus.FAILED,
                s.errorMessage = :message,
                s.completedAt = :now,
                s.updatedAt = :now
            WHERE s.id = :id AND s.status NOT IN :terminal
            """)
    int failIfActive(@Param("id") UUID id,
                     @Param("message") String message,
                     @Param("now") Instant now,
                     @Param("terminal") Collection<SessionStatus> terminal);

    @Query("SELECT s.status FROM GenerationSession s WHERE s.id = :id")
    Optional<SessionStatus> findStatusById(@Param("id") UUID id);
}
