package com.specforge.orchestrator.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.specforge.orchestrator.claude.ClaudeClient.ClaudeApiException;
import com.specforge.orchestrator.claude.CompletionClient;
import com.specforge.orchestrator.config.PipelineProperties;
import com.specforge.orchestrator.github.SourceControlClient;
import com.specforge.orchestrator.github.SourceControlClient.PutFileResult;
import com.specforge.orchestrator.github.SourceControlException;
import com.specforge.orchestrator.model.*;
import com.specforge.orchestrator.store.SessionStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the per-file pipeline.
 *
 * The store mock records the file state at every upsert, so tests can
 * assert the exact sequence of persisted transitions.
 */
@ExtendWith(MockitoExtension.class)
class FileWorkerTest {

    private static final String CODE       = "export default function App() { return <div/>; }\n";
    private static final String FIXED_CODE = "export default function App(): JSX.Element { return <div/>; }\n";
    private static final String CLEAN      = "{\"qualityScore\": 92, \"issues\": [], \"recommendations\": []}";
    private static final String ONE_HIGH   = """
            {"qualityScore": 55,
             "issues": [{"severity": "high", "location": "App", "message": "missing return type"}]}
            """;

    @Mock CompletionClient    completion;
    @Mock SourceControlClient sourceControl;
    @Mock SessionStore        store;

    FileWorker          worker;
    SimpleMeterRegistry registry;
    UUID                sessionId;
    ManifestEntry       entry;
    List<FileState>     persisted;

    @BeforeEach
    void setUp() throws Exception {
        registry  = new SimpleMeterRegistry();
        worker    = new FileWorker(completion, sourceControl, store,
                new PromptTemplates(new ObjectMapper()), new PipelineMetrics(registry),
                PipelineProperties.defaults());
        sessionId = UUID.randomUUID();
        entry     = new ManifestEntry("src/App.tsx", FileCategory.FRONTEND, "root component", Set.of());
        persisted = new ArrayList<>();

        lenient().when(store.currentStatus(sessionId)).thenReturn(Optional.of(SessionStatus.GENERATING));
        lenient().doAnswer(inv -> persisted.add(((FileProgress) inv.getArgument(1)).state()))
                .when(store).upsertFileResult(eq(sessionId), any());
    }

    // ------------------------------------------------------------------
    // Happy paths
    // ------------------------------------------------------------------

    @Test
    void process_cleanAnalysis_skipsFixAndPublish() {
        replies(CODE, CLEAN);

        FileOutcome outcome = worker.process(context(null), entry, 0);

        assertThat(outcome.state()).isEqualTo(FileState.DONE);
        assertThat(outcome.fixOutcome()).isEqualTo(FixOutcome.NOT_REQUIRED);
        assertThat(outcome.publishOutcome()).isEqualTo(PublishOutcome.SKIPPED);
        assertThat(persisted).containsExactly(
                FileState.GENERATING, FileState.ANALYZING, FileState.PERSISTING, FileState.DONE);
        verify(completion, times(2)).complete(anyString(), anyInt(), anyDouble());
        verifyNoInteractions(sourceControl);
    }

    @Test
    void process_highIssue_fixedExactlyOnce() {
        replies(CODE, ONE_HIGH, "```tsx\n" + FIXED_CODE + "```");

        FileOutcome outcome = worker.process(context(null), entry, 0);

        assertThat(outcome.state()).isEqualTo(FileState.DONE);
        assertThat(outcome.fixOutcome()).isEqualTo(FixOutcome.APPLIED);
        assertThat(persisted).containsExactly(FileState.GENERATING, FileState.ANALYZING,
                FileState.FIXING, FileState.PERSISTING, FileState.DONE);
        verify(completion, times(3)).complete(anyString(), anyInt(), anyDouble());

        FileProgress last = lastUpsert();
        assertThat(last.content()).isEqualTo(FIXED_CODE);
        assertThat(last.fixApplied()).isTrue();
        assertThat(last.analysis().issues()).hasSize(1);
    }

    @Test
    void process_withPublishTarget_publishesWithCommitMessage() {
        replies(CODE, CLEAN);
        when(sourceControl.putFile(any(), any(), any(), any(), any(), any()))
                .thenReturn(new PutFileResult("abc123", "https://github.com/acme/todo/blob/dev/src/App.tsx"));

        FileOutcome outcome = worker.process(context(new PublishTarget("acme", "todo", "dev")), entry, 0);

        assertThat(outcome.publishOutcome()).isEqualTo(PublishOutcome.PUBLISHED);
        verify(sourceControl).putFile("acme", "todo", "src/App.tsx", CODE, "dev",
                "Add generated file src/App.tsx");
        assertThat(lastUpsert().publishRecord().revisionId()).isEqualTo("abc123");
        assertThat(persisted).contains(FileState.PUBLISHING);
    }

    // ------------------------------------------------------------------
    // Absorbed failures
    // ------------------------------------------------------------------

    @Test
    void process_unparseableAnalysis_usesFallbackAndSkipsFix() {
        replies(CODE, "The code looks fine overall.");

        FileOutcome outcome = worker.process(context(null), entry, 0);

        assertThat(outcome.state()).isEqualTo(FileState.DONE);
        assertThat(outcome.analysisFallback()).isTrue();
        assertThat(outcome.fixOutcome()).isEqualTo(FixOutcome.NOT_REQUIRED);
        assertThat(lastUpsert().analysis().qualityScore()).isEqualTo(70);
        verify(completion, times(2)).complete(anyString(), anyInt(), anyDouble());
    }

    @Test
    void process_analysisCallFails_usesFallback() {
        when(completion.complete(anyString(), anyInt(), anyDouble()))
                .thenReturn(CODE)
                .thenThrow(new ClaudeApiException(500, "boom"));

        FileOutcome outcome = worker.process(context(null), entry, 0);

        assertThat(outcome.state()).isEqualTo(FileState.DONE);
        assertThat(outcome.analysisFallback()).isTrue();
    }

    @Test
    void process_fixReturnsBlank_keepsOriginalContent() {
        replies(CODE, ONE_HIGH, "   ");

        FileOutcome outcome = worker.process(context(null), entry, 0);

        assertThat(outcome.state()).isEqualTo(FileState.DONE);
        assertThat(outcome.fixOutcome()).isEqualTo(FixOutcome.FAILED);
        assertThat(lastUpsert().content()).isEqualTo(CODE);
        assertThat(lastUpsert().fixApplied()).isFalse();
    }

    @Test
    void process_publishFails_stillDoneWithErrorLogged() {
        replies(CODE, CLEAN);
        when(sourceControl.putFile(any(), any(), any(), any(), any(), any()))
                .thenThrow(new SourceControlException("HTTP 403"));

        FileOutcome outcome = worker.process(context(new PublishTarget("acme", "todo", null)), entry, 0);

        assertThat(outcome.state()).isEqualTo(FileState.DONE);
        assertThat(outcome.publishOutcome()).isEqualTo(PublishOutcome.FAILED);
        assertThat(outcome.errors()).singleElement().asString().contains("HTTP 403");
        assertThat(lastUpsert().persisted()).isTrue();
    }

    // ------------------------------------------------------------------
    // Errored and cancelled
    // ------------------------------------------------------------------

    @Test
    void process_blankGeneration_errored() {
        replies("```\n```");

        FileOutcome outcome = worker.process(context(null), entry, 0);

        assertThat(outcome.state()).isEqualTo(FileState.ERRORED);
        assertThat(outcome.errors().get(0)).contains("EMPTY_GENERATION");
        assertThat(persisted).containsExactly(FileState.GENERATING, FileState.ERRORED);
        assertThat(registry.counter("specforge.file.outcomes", "state", "errored", "publish", "none").count())
                .isEqualTo(1.0);
    }

    @Test
    void process_generationCallFails_errored() {
        when(completion.complete(anyString(), anyInt(), anyDouble()))
                .thenThrow(new ClaudeApiException("connection refused", null));

        FileOutcome outcome = worker.process(context(null), entry, 0);

        assertThat(outcome.isErrored()).isTrue();
        assertThat(outcome.errors().get(0)).contains("connection refused");
    }

    @Test
    void process_sessionCancelledDuringGeneration_stopsWithoutFurtherWrites() {
        when(store.currentStatus(sessionId))
                .thenReturn(Optional.of(SessionStatus.GENERATING))
                .thenReturn(Optional.of(SessionStatus.FAILED));
        replies(CODE);

        FileOutcome outcome = worker.process(context(null), entry, 0);

        assertThat(outcome.cancelled()).isTrue();
        assertThat(outcome.state()).isEqualTo(FileState.GENERATING);
        assertThat(persisted).containsExactly(FileState.GENERATING);
        verify(completion, times(1)).complete(anyString(), anyInt(), anyDouble());
    }

    @Test
    void process_storeFailsMidPipeline_errored() {
        replies(CODE, CLEAN);
        doAnswer(inv -> {
            FileProgress p = inv.getArgument(1);
            if (p.state() == FileState.PERSISTING) throw new IllegalStateException("db down");
            persisted.add(p.state());
            return null;
        }).when(store).upsertFileResult(eq(sessionId), any());

        FileOutcome outcome = worker.process(context(null), entry, 0);

        assertThat(outcome.isErrored()).isTrue();
        assertThat(outcome.errors().get(0)).contains("db down");
        assertThat(persisted).endsWith(FileState.ERRORED);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private WorkerContext context(PublishTarget target) {
        JsonNode spec = new ObjectMapper().createObjectNode().put("project_name", "todo");
        Manifest manifest = new Manifest(List.of(entry), List.of("GET /items"), List.of());
        return new WorkerContext(sessionId, spec, TargetConfig.unspecified(), manifest, target);
    }

    private void replies(String first, String... rest) {
        when(completion.complete(anyString(), anyInt(), anyDouble())).thenReturn(first, rest);
    }

    private FileProgress lastUpsert() {
        ArgumentCaptor<FileProgress> captor = ArgumentCaptor.forClass(FileProgress.class);
        verify(store, atLeastOnce()).upsertFileResult(eq(sessionId), captor.capture());
        return captor.getValue();
    }
}
