package com.specforge.orchestrator.api.dto;

import com.specforge.orchestrator.model.Manifest;
import com.specforge.orchestrator.model.PublishTarget;
import com.specforge.orchestrator.model.TargetConfig;
import com.specforge.orchestrator.store.SessionSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response body for GET /code/status/{id} and POST /code/cancel/{id}.
 */
public record SessionResponse(
        UUID                     sessionId,
        String                   status,
        String                   specificationRef,
        TargetConfig             frameworks,
        PublishTarget            repository,
        String                   modelUsed,
        Manifest                 manifest,
        int                      totalFiles,
        Integer                  filesGenerated,
        List<FileResultResponse> results,
        String                   error,
        List<String>             warnings,
        Instant                  createdAt,
        Instant                  updatedAt,
        Instant                  completedAt
) {
    public static SessionResponse from(SessionSnapshot s) {
        return new SessionResponse(
                s.id(),
                s.status().name(),
                s.specificationRef(),
                s.targetConfig(),
                s.publishTarget(),
                s.modelUsed(),
                s.manifest(),
                s.manifest() == null ? 0 : s.manifest().size(),
                s.filesGenerated(),
                s.results().stream().map(FileResultResponse::from).toList(),
                s.errorMessage(),
                s.warnings(),
                s.createdAt(),
                s.updatedAt(),
                s.completedAt());
    }
}
