package com.specforge.orchestrator.api.dto;

import com.specforge.orchestrator.model.*;
import com.specforge.orchestrator.store.SessionSnapshot.FileSnapshot;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FileResultResponseTest {

    @Test
    void generationFailed_laterStagesSkippedNotFailed() {
        FileSnapshot f = file(FileState.ERRORED, null, null, false, null, false, null,
                List.of("Generation failed: HTTP 529"));

        FileResultResponse.Stages stages = FileResultResponse.from(f).stages();

        assertThat(stages.generation()).isEqualTo("failed");
        assertThat(stages.analysis()).isEqualTo("skipped");
        assertThat(stages.fix()).isEqualTo("skipped");
        assertThat(stages.persistence()).isEqualTo("skipped");
        assertThat(stages.publish()).isEqualTo("skipped");
    }

    @Test
    void erroredAfterGeneration_persistenceFailed() {
        FileSnapshot f = file(FileState.ERRORED, "print(1)", StaticAnalysisReport.fallback("x"), true,
                FixOutcome.NOT_REQUIRED, false, null, List.of("Failed during ANALYZING: db down"));

        FileResultResponse.Stages stages = FileResultResponse.from(f).stages();

        assertThat(stages.generation()).isEqualTo("succeeded");
        assertThat(stages.analysis()).isEqualTo("fallback");
        assertThat(stages.fix()).isEqualTo("not_required");
        assertThat(stages.persistence()).isEqualTo("failed");
    }

    @Test
    void inFlightFile_unreachedStagesPending() {
        FileSnapshot f = file(FileState.GENERATING, null, null, false, null, false, null, List.of());

        FileResultResponse.Stages stages = FileResultResponse.from(f).stages();

        assertThat(stages).isEqualTo(new FileResultResponse.Stages(
                "pending", "pending", "pending", "pending", "pending"));
    }

    @Test
    void doneFile_allStagesReported() {
        FileSnapshot f = file(FileState.DONE, "print(1)", new StaticAnalysisReport(92, List.of(), List.of()),
                false, FixOutcome.NOT_REQUIRED, true, PublishOutcome.FAILED, List.of("Publish failed: 403"));

        FileResultResponse response = FileResultResponse.from(f);

        assertThat(response.stages()).isEqualTo(new FileResultResponse.Stages(
                "succeeded", "succeeded", "not_required", "succeeded", "failed"));
        assertThat(response.qualityGrade()).isNotNull();
    }

    private static FileSnapshot file(FileState state, String content, StaticAnalysisReport analysis,
                                     boolean fallback, FixOutcome fix, boolean persisted,
                                     PublishOutcome publish, List<String> errors) {
        return new FileSnapshot("main.py", FileCategory.BACKEND, "api", 0, "python", state, content,
                analysis, fallback, fix == FixOutcome.APPLIED, fix, persisted, publish, null, errors);
    }
}
