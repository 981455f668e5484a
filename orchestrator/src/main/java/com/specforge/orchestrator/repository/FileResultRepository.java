package com.specforge.orchestrator.repository;

import com.specforge.orchestrator.model.FileResult;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD for the file_results table. Rows are addressed by (session, path).
 */
public interface FileResultRepository extends JpaRepository<FileResult, UUID> {

    Optional<FileResult> findBySessionIdAndPath(UUID sessionId, String path);

    /** All results for a session in manifest order. */
    List<FileResult> findBySessionIdOrderByPositionAsc(UUID sessionId);
}
