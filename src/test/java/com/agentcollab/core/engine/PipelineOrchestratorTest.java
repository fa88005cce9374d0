package com.agentcollab.core.engine;

import com.agentcollab.adapter.ToolRequest;
import com.agentcollab.adapter.ToolResponse;
import com.agentcollab.core.model.LastFailure;
import com.agentcollab.core.model.PipelineResult;
import com.agentcollab.core.model.PipelineStatus;
import com.agentcollab.core.model.SessionRecord;
import com.agentcollab.core.model.SessionStatus;
import com.agentcollab.core.model.StagePlan;
import com.agentcollab.core.model.StageResult;
import com.agentcollab.core.model.StageSpec;
import com.agentcollab.core.model.StageStatus;
import com.agentcollab.core.model.ToolExitStatus;
import com.agentcollab.core.review.ReviewStageHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PipelineOrchestratorTest {

    @TempDir
    Path taskDir;

    private EngineFixture fixture;
    private PipelineOrchestrator orchestrator;

    private final StagePlan plan = new StagePlan("impl", "impl", null, List.of(
            StageSpec.of("codex", "implement", Duration.ofMinutes(5)),
            StageSpec.of("codex", "fix", Duration.ofMinutes(5)),
            StageSpec.of("codex", "verify", Duration.ofMinutes(5))));

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture(taskDir);
        fixture.store.writeDocument("inputs/user_request.md", "Harden the login flow.");
        orchestrator = fixture.orchestrator();
    }

    private static ToolResponse withThread(String threadId) {
        return new ToolResponse("# Result\n", "", ToolExitStatus.SUCCESS, 0, null,
                "{\"type\":\"thread.started\",\"thread_id\":\"" + threadId + "\"}\n{\"type\":\"turn.completed\"}\n");
    }

    @Nested
    @DisplayName("sequencing")
    class Sequencing {

        @Test
        @DisplayName("runs every stage in order and writes a summary")
        void completes() {
            PipelineResult result = orchestrator.run(plan);

            assertEquals(PipelineStatus.COMPLETED, result.status());
            assertNull(result.failedStage());
            assertEquals(List.of("codex_implement", "codex_fix", "codex_verify"),
                    fixture.adapter.requests().stream().map(ToolRequest::stageId).toList());

            String summary = fixture.store.readDocument(SummaryWriter.SUMMARY_DOCUMENT).orElseThrow();
            assertTrue(summary.contains("### codex_implement (codex/implement) - done"));
            assertTrue(summary.contains("### codex_verify (codex/verify) - done"));
            assertTrue(summary.contains("paid_calls_used: 3"));
        }

        @Test
        @DisplayName("the first failure stops the pipeline")
        void stopsOnFirstFailure() {
            fixture.adapter.onStage("codex_fix", request ->
                    ToolResponse.failure(ToolExitStatus.GENERAL_FAILURE, 1, "403 Forbidden"));

            PipelineResult result = orchestrator.run(plan);

            assertEquals(PipelineStatus.FAILED, result.status());
            assertEquals("codex_fix", result.failedStage());
            assertEquals("auth", result.lastFailure().errorClass());
            assertEquals(2, result.stages().size());
            assertTrue(fixture.adapter.requestsFor("codex_verify").isEmpty());

            String summary = fixture.store.readDocument(SummaryWriter.SUMMARY_DOCUMENT).orElseThrow();
            assertTrue(summary.contains("### codex_fix (codex/fix) - failed"));
            assertTrue(summary.contains("403 Forbidden"));
            assertTrue(summary.contains("## Last Failure"));
        }

        @Test
        @DisplayName("a re-run resumes at the failed stage")
        void rerunSkipsDoneStages() {
            fixture.adapter.onStage("codex_fix", request ->
                    ToolResponse.failure(ToolExitStatus.GENERAL_FAILURE, 1, "401 Unauthorized"));
            orchestrator.run(plan);

            fixture.adapter.onStage("codex_fix", request -> ToolResponse.success("# Fixed\n"));
            PipelineResult second = orchestrator.run(plan);

            assertEquals(PipelineStatus.COMPLETED, second.status());
            assertEquals(StageStatus.SKIPPED_DONE, second.stages().get(0).status());
            assertEquals(1, fixture.adapter.requestsFor("codex_implement").size());
            assertEquals(2, fixture.adapter.requestsFor("codex_fix").size());
        }

        @Test
        @DisplayName("runs a single stage on request")
        void runSingle() {
            PipelineResult result = orchestrator.runSingle(plan, "codex_verify");

            assertEquals(PipelineStatus.COMPLETED, result.status());
            assertEquals(1, result.stages().size());
            assertEquals(List.of("codex_verify"),
                    fixture.adapter.requests().stream().map(ToolRequest::stageId).toList());
        }

        @Test
        @DisplayName("an unknown stage id is rejected")
        void unknownStage() {
            assertThrows(IllegalArgumentException.class, () -> orchestrator.runSingle(plan, "gemini_plan"));
        }
    }

    @Nested
    @DisplayName("aborts")
    class Aborts {

        @Test
        @DisplayName("an exhausted budget fails the stage without calling the tool")
        void budgetExhausted() {
            fixture.properties.getBudgets().setPaidCallBudget(1);

            PipelineResult result = orchestrator.run(plan);

            assertEquals(PipelineStatus.FAILED, result.status());
            assertEquals("codex_fix", result.failedStage());
            LastFailure failure = fixture.store.readLastFailure().orElseThrow();
            assertEquals("budget_exhausted", failure.errorClass());
            assertEquals(-1, failure.exitCode());
            assertTrue(fixture.adapter.requestsFor("codex_fix").isEmpty());
        }

        @Test
        @DisplayName("a resumed call that reports another session stops with a recovery document")
        void sessionMismatch() {
            fixture.adapter
                    .then(withThread("S1"))
                    .then(withThread("S1"))
                    .then(withThread("S2"));

            PipelineResult result = orchestrator.run(plan);

            assertEquals(PipelineStatus.FAILED, result.status());
            assertEquals("codex_verify", result.failedStage());
            assertEquals("session_mismatch", result.lastFailure().errorClass());
            assertFalse(fixture.store.hasDoneMarker("codex_verify"));

            String recovery = fixture.store.readDocument("state/session_recovery.md").orElseThrow();
            assertTrue(recovery.contains("Expected session ID: S1"));
            assertTrue(recovery.contains("Actual session ID: S2"));

            SessionRecord session = fixture.store.readSession("impl", "codex").orElseThrow();
            assertEquals("S1", session.sessionId());
            assertEquals(SessionStatus.ACTIVE, session.status());

            assertNull(fixture.adapter.requestsFor("codex_implement").get(0).resumeSessionId());
            assertEquals("S1", fixture.adapter.requestsFor("codex_fix").get(0).resumeSessionId());
            assertEquals("S1", fixture.adapter.requestsFor("codex_verify").get(0).resumeSessionId());
            assertEquals(1.0, fixture.registry.get("agentcollab.session.mismatches").counter().count());
        }

        @Test
        @DisplayName("an unexpected error records an internal failure and still writes the summary")
        void internalError() {
            ReviewStageHandler handler = mock(ReviewStageHandler.class);
            StageSpec review = StageSpec.of("codex", "review", Duration.ofMinutes(5));
            when(handler.supports(any())).thenReturn(true);
            when(handler.handle(any(), any())).thenThrow(new IllegalStateException("findings file is corrupt"));

            PipelineResult result = fixture.orchestrator(handler)
                    .run(new StagePlan("review", "review", null, List.of(review)));

            assertEquals(PipelineStatus.FAILED, result.status());
            assertEquals("codex_review", result.failedStage());
            LastFailure failure = fixture.store.readLastFailure().orElseThrow();
            assertEquals("internal", failure.errorClass());
            assertEquals(-1, failure.exitCode());
            assertTrue(failure.decision().contains("findings file is corrupt"));
            assertTrue(fixture.store.readDocument(SummaryWriter.SUMMARY_DOCUMENT).isPresent());
        }
    }

    @Test
    @DisplayName("review stages are delegated to the review handler")
    void delegatesReview() {
        ReviewStageHandler handler = mock(ReviewStageHandler.class);
        StageSpec review = StageSpec.of("codex", "review", Duration.ofMinutes(5));
        when(handler.supports(any())).thenAnswer(inv -> "review".equals(((StageSpec) inv.getArgument(0)).role()));
        when(handler.handle(any(), any())).thenReturn(
                new StageResult(review.stageId(), "codex", "review", StageStatus.DONE, "# Parallel Review Summary", null, 0));

        PipelineResult result = fixture.orchestrator(handler)
                .run(new StagePlan("review", "review", null, List.of(review)));

        assertEquals(PipelineStatus.COMPLETED, result.status());
        verify(handler).handle(any(), any());
        assertTrue(fixture.adapter.requests().isEmpty());
    }
}
