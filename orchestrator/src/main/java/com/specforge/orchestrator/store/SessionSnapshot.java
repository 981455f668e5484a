package com.specforge.orchestrator.store;

import com.specforge.orchestrator.model.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Point-in-time, detached copy of a session and its file results.
 *
 * This is what status polling returns; it never holds a live entity, so it
 * can be read outside a transaction.
 */
public record SessionSnapshot(
        UUID             id,
        SessionStatus    status,
        String           specificationRef,
        TargetConfig     targetConfig,
        PublishTarget    publishTarget,
        Manifest         manifest,
        List<FileSnapshot> results,
        String           errorMessage,
        List<String>     warnings,
        String           modelUsed,
        Integer          filesGenerated,
        Instant          createdAt,
        Instant          updatedAt,
        Instant          completedAt
) {

    public record FileSnapshot(
            String               path,
            FileCategory         category,
            String               purpose,
            int                  position,
            String               language,
            FileState            state,
            String               content,
            StaticAnalysisReport analysis,
            boolean              analysisFallback,
            boolean              fixApplied,
            FixOutcome           fixOutcome,
            boolean              persisted,
            PublishOutcome       publishOutcome,
            PublishRecord        publishRecord,
            List<String>         errors
    ) {}
}
