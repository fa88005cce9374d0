package com.agentcollab.core.engine;

import com.agentcollab.adapter.ToolRequest;
import com.agentcollab.adapter.ToolResponse;
import com.agentcollab.core.model.ErrorClass;
import com.agentcollab.core.model.LastFailure;
import com.agentcollab.core.model.SessionMode;
import com.agentcollab.core.model.StageResult;
import com.agentcollab.core.model.StageRun;
import com.agentcollab.core.model.StageSpec;
import com.agentcollab.core.model.StageStatus;
import com.agentcollab.core.model.ToolExitStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class StageExecutorTest {

    @TempDir
    Path taskDir;

    private EngineFixture fixture;
    private StageContext context;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture(taskDir);
        fixture.properties.getBudgets().setPaidCallBudget(10);
        fixture.properties.getBudgets().setRetryBudget(2);
        fixture.store.writeDocument("inputs/user_request.md", "Add input validation to the upload handler.");
        context = StageContext.of("impl", SessionMode.OFF);
    }

    private static StageSpec stage(String tool, String role) {
        return StageSpec.of(tool, role, Duration.ofMinutes(5));
    }

    @Nested
    @DisplayName("successful stage")
    class Success {

        @Test
        @DisplayName("records one paid call, the meta record and the done-marker")
        void happyPath() {
            fixture.usePaidCalls(5);
            fixture.adapter.then(ToolResponse.success("# Plan\n1. validate size\n"));

            StageResult result = fixture.executor.execute(stage("claude", "plan"), context);

            assertEquals(StageStatus.DONE, result.status());
            assertEquals(1, result.attempts());
            assertEquals(6, fixture.store.loadStats().paidCallsUsed());
            assertTrue(fixture.store.hasDoneMarker("claude_plan"));
            assertEquals(List.of("claude_plan"), fixture.store.loadStats().stagesCompleted());

            StageRun run = fixture.store.readStageRun("claude_plan", "claude").orElseThrow();
            assertEquals(0, run.exitCode());
            assertEquals(ToolExitStatus.SUCCESS, run.exitStatus());
            assertEquals(64, run.requestSha256().length());
        }

        @Test
        @DisplayName("a stage with a done-marker is skipped without a tool call")
        void idempotentRerun() {
            fixture.executor.execute(stage("claude", "plan"), context);
            int paid = fixture.store.loadStats().paidCallsUsed();

            StageResult again = fixture.executor.execute(stage("claude", "plan"), context);

            assertEquals(StageStatus.SKIPPED_DONE, again.status());
            assertEquals(0, again.attempts());
            assertEquals(paid, fixture.store.loadStats().paidCallsUsed());
            assertEquals(1, fixture.adapter.requests().size());
        }

        @Test
        @DisplayName("the request carries the user request and attachments")
        void composesPrompt() {
            fixture.executor.execute(stage("codex", "implement"),
                    context.withAttachment("Notes", "keep the public API stable"));

            String prompt = fixture.adapter.requests().get(0).prompt();
            assertTrue(prompt.contains("## User Request"));
            assertTrue(prompt.contains("Add input validation"));
            assertTrue(prompt.contains("## Notes\nkeep the public API stable"));
        }

        @Test
        @DisplayName("publishes started and completed events")
        void publishesEvents() {
            List<String> types = new CopyOnWriteArrayList<>();
            fixture.eventBus.subscribe("impl", e -> types.add(e.eventType()));

            fixture.executor.execute(stage("codex", "implement"), context);

            assertEquals(List.of("stage.started", "stage.completed"), types);
        }
    }

    @Nested
    @DisplayName("budget")
    class Budget {

        @Test
        @DisplayName("refuses to call the tool once the budget is used up")
        void exhausted() {
            fixture.properties.getBudgets().setPaidCallBudget(3);
            fixture.usePaidCalls(3);

            BudgetExhaustedException e = assertThrows(BudgetExhaustedException.class,
                    () -> fixture.executor.execute(stage("codex", "implement"), context));

            assertTrue(e.getMessage().contains("codex_implement"));
            assertTrue(fixture.adapter.requests().isEmpty());
            assertEquals(3, fixture.store.loadStats().paidCallsUsed());
        }

        @Test
        @DisplayName("a retry never exceeds the budget")
        void retryStopsAtBudget() {
            fixture.properties.getBudgets().setPaidCallBudget(1);
            fixture.adapter.then(ToolResponse.failure(ToolExitStatus.TIMEOUT, 124, "request timeout"));

            assertThrows(BudgetExhaustedException.class,
                    () -> fixture.executor.execute(stage("codex", "implement"), context));
            assertEquals(1, fixture.store.loadStats().paidCallsUsed());
        }

        @Test
        @DisplayName("concurrent stages cannot overspend the last paid call")
        void concurrentStagesShareBudget() throws Exception {
            fixture.properties.getBudgets().setPaidCallBudget(1);
            fixture.adapter.otherwise(request -> {
                Thread.sleep(200);
                return ToolResponse.success("# Review\nNo issues.\n");
            });
            StageContext review = StageContext.of("review", SessionMode.OFF);
            List<StageSpec> lenses = List.of(stage("codex", "review_correctness"),
                    stage("codex", "review_security"), stage("codex", "review_maintainability"));

            ExecutorService pool = Executors.newFixedThreadPool(lenses.size());
            CountDownLatch start = new CountDownLatch(1);
            List<Future<StageResult>> futures = new ArrayList<>();
            try {
                for (StageSpec lens : lenses) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        return fixture.executor.execute(lens, review);
                    }));
                }
                start.countDown();

                int done = 0;
                int refused = 0;
                for (Future<StageResult> future : futures) {
                    try {
                        if (future.get(10, TimeUnit.SECONDS).status() == StageStatus.DONE) {
                            done++;
                        }
                    } catch (ExecutionException e) {
                        assertInstanceOf(BudgetExhaustedException.class, e.getCause());
                        refused++;
                    }
                }

                assertEquals(1, done);
                assertEquals(2, refused);
                assertEquals(1, fixture.adapter.requests().size());
                assertEquals(1, fixture.store.loadStats().paidCallsUsed());
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("transient failures retry until the signature count reaches the retry budget")
        void transientRetries() {
            ToolResponse timeout = ToolResponse.failure(ToolExitStatus.TIMEOUT, 124,
                    "connection reset by peer at 10:42:13");
            fixture.adapter.then(timeout).then(timeout).then(ToolResponse.success("never reached"));

            StageResult result = fixture.executor.execute(stage("codex", "implement"), context);

            assertEquals(StageStatus.FAILED, result.status());
            assertEquals(2, result.attempts());
            assertEquals(ErrorClass.TRANSIENT, result.triage().errorClass());
            assertEquals(2, fixture.store.loadStats().signatureCount(result.triage().signature()));
            assertEquals(2, fixture.store.loadStats().paidCallsUsed());
            assertFalse(fixture.store.hasDoneMarker("codex_implement"));

            LastFailure failure = fixture.store.readLastFailure().orElseThrow();
            assertEquals("transient", failure.errorClass());
            assertEquals("codex_implement", failure.stage());
            assertEquals(124, failure.exitCode());
            assertFalse(failure.suggestedActions().isEmpty());
        }

        @Test
        @DisplayName("an oversized request is retried once with aggressive compaction")
        void compactionRetry() {
            fixture.store.writeDocument(ContextPropagator.CONTEXT_PACK, "x".repeat(12_000));
            fixture.adapter
                    .then(ToolResponse.failure(ToolExitStatus.INPUT_TOO_LARGE, 3, "prompt too large"))
                    .then(ToolResponse.success("# Done\n"));

            StageResult result = fixture.executor.execute(stage("codex", "implement"), context);

            assertEquals(StageStatus.DONE, result.status());
            assertEquals(2, result.attempts());
            List<ToolRequest> requests = fixture.adapter.requests();
            assertFalse(requests.get(0).prompt().contains("[compacted:"));
            assertTrue(requests.get(1).prompt().contains("[compacted:"));
            assertTrue(requests.get(1).prompt().length() < requests.get(0).prompt().length());
        }

        @Test
        @DisplayName("auth failures are never retried")
        void authStops() {
            fixture.adapter.then(ToolResponse.failure(ToolExitStatus.GENERAL_FAILURE, 1,
                    "Error: 401 Unauthorized"));

            StageResult result = fixture.executor.execute(stage("claude", "plan"), context);

            assertEquals(StageStatus.FAILED, result.status());
            assertEquals(1, result.attempts());
            assertEquals(ErrorClass.AUTH, result.triage().errorClass());
        }

        @Test
        @DisplayName("a successful exit that misses required sections is a contract violation")
        void gateViolation() {
            fixture.adapter.then(ToolResponse.success("# Brief\nno context pack here\n"));

            StageResult result = fixture.executor.execute(stage("claude", "brief"), context);

            assertEquals(StageStatus.FAILED, result.status());
            assertEquals(ErrorClass.CONTRACT_VIOLATION, result.triage().errorClass());
            assertFalse(fixture.store.hasDoneMarker("claude_brief"));
            assertEquals(1, fixture.store.loadStats().paidCallsUsed());
            assertEquals("contract_violation", fixture.store.readLastFailure().orElseThrow().errorClass());
        }

        @Test
        @DisplayName("an interrupted call is recorded before the interruption surfaces")
        void interrupted() {
            fixture.adapter.thenAnswer(request -> {
                throw new InterruptedException("cancelled");
            });

            try {
                assertThrows(StageInterruptedException.class,
                        () -> fixture.executor.execute(stage("codex", "implement"), context));
                assertTrue(Thread.currentThread().isInterrupted());
            } finally {
                Thread.interrupted();
            }

            StageRun run = fixture.store.readStageRun("codex_implement", "codex").orElseThrow();
            assertEquals(StageExecutor.EXIT_INTERRUPTED, run.exitCode());
            assertEquals(1, fixture.store.loadStats().paidCallsUsed());
        }
    }

    @Nested
    @DisplayName("context propagation")
    class Propagation {

        @Test
        @DisplayName("a brief replaces the context pack and the acceptance commands")
        void briefUpdatesContext() {
            fixture.adapter.then(ToolResponse.success("""
                    # Brief

                    ## Updated Context Pack

                    ## 1. Goal
                    Validate uploads.

                    ## 2. Files
                    - upload.py

                    ## Verify Commands
                    ```
                    pytest tests/test_upload.py
                    ```
                    """));

            StageResult result = fixture.executor.execute(stage("claude", "brief"), context);

            assertEquals(StageStatus.DONE, result.status());
            String pack = fixture.store.readDocument(ContextPropagator.CONTEXT_PACK).orElseThrow();
            assertTrue(pack.startsWith("## 1. Goal"));
            assertTrue(pack.contains("- upload.py"));
            assertFalse(pack.contains("Verify Commands"));
            assertEquals("pytest tests/test_upload.py\n",
                    fixture.store.readDocument(ContextPropagator.ACCEPTANCE_OVERRIDE).orElseThrow());
        }

        @Test
        @DisplayName("non-brief roles leave the context pack alone")
        void otherRolesDoNotPropagate() {
            fixture.store.writeDocument(ContextPropagator.CONTEXT_PACK, "## 1. Original\n");
            fixture.adapter.then(ToolResponse.success("## Updated Context Pack\n## 1. Other\n"));

            fixture.executor.execute(stage("codex", "implement"), context);

            assertEquals("## 1. Original\n", fixture.store.readDocument(ContextPropagator.CONTEXT_PACK).orElseThrow());
        }
    }

    @Test
    @DisplayName("records a failure counter per error class")
    void recordsFailureMetric() {
        fixture.adapter.then(ToolResponse.failure(ToolExitStatus.MISSING_BINARY, 127, "codex: command not found"));

        fixture.executor.execute(stage("codex", "implement"), context);

        assertEquals(1.0, fixture.registry.get("agentcollab.stage.failures").tag("class", "tooling").counter().count());
        assertEquals(1.0, fixture.registry.get("agentcollab.paid_calls.total").tag("tool", "codex").counter().count());
    }
}
