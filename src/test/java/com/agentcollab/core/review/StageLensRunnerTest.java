package com.agentcollab.core.review;

import com.agentcollab.adapter.ToolRequest;
import com.agentcollab.adapter.ToolResponse;
import com.agentcollab.core.engine.EngineFixture;
import com.agentcollab.core.engine.StageContext;
import com.agentcollab.core.model.SessionMode;
import com.agentcollab.core.model.ToolExitStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StageLensRunnerTest {

    @TempDir
    Path taskDir;

    private EngineFixture fixture;
    private StageLensRunner runner;
    private final StageContext context = StageContext.of("review", SessionMode.FORCED_WITHIN_PHASE);

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture(taskDir);
        runner = new StageLensRunner(fixture.executor, fixture.store, fixture.properties);
    }

    @Test
    @DisplayName("runs the lens as a fresh review stage with its focus attached")
    void completed() {
        fixture.adapter.onStage("codex_review_security", request ->
                ToolResponse.success("- [medium] upload.py: no size limit\n"));

        LensReport report = runner.run(LensPrompts.SECURITY, 0, context);

        assertEquals(LensStatus.COMPLETED, report.status());
        assertEquals("codex_review_security", report.stageId());
        assertEquals("- [medium] upload.py: no size limit\n", report.output());

        ToolRequest request = fixture.adapter.requestsFor("codex_review_security").get(0);
        assertNull(request.resumeSessionId());
        assertTrue(request.prompt().contains("## Review Lens\nsecurity"));
        assertTrue(request.prompt().contains(LensPrompts.focus(LensPrompts.SECURITY)));
        assertTrue(request.prompt().contains("- Analysis only. Do not apply fixes."));
    }

    @Test
    @DisplayName("security re-reviews get a per-round stage id")
    void roundStageId() {
        LensReport report = runner.run(LensPrompts.SECURITY, 2, context);

        assertEquals("codex_review_security_r2", report.stageId());
        assertEquals(1, fixture.adapter.requestsFor("codex_review_security_r2").size());
    }

    @Test
    @DisplayName("a failed lens stage is degraded with the tool's exit code")
    void degraded() {
        fixture.adapter.onStage("codex_review_correctness", request ->
                ToolResponse.failure(ToolExitStatus.MISSING_BINARY, 127, "codex: command not found"));

        LensReport report = runner.run(LensPrompts.CORRECTNESS, 0, context);

        assertTrue(report.isDegraded());
        assertEquals(127, report.exitCode());
        assertTrue(report.output().contains("Status: DEGRADED (exit=127)"));
    }

    @Test
    @DisplayName("an exhausted budget degrades the lens instead of throwing")
    void budgetExhausted() {
        fixture.properties.getBudgets().setPaidCallBudget(0);

        LensReport report = runner.run(LensPrompts.MAINTAINABILITY, 0, context);

        assertTrue(report.isDegraded());
        assertEquals(-1, report.exitCode());
        assertTrue(fixture.adapter.requests().isEmpty());
    }

    @Test
    @DisplayName("a lens that already finished returns its recorded output")
    void alreadyDone() {
        fixture.adapter.onStage("codex_review_correctness", request -> ToolResponse.success("- [low] a.py: rename x\n"));
        runner.run(LensPrompts.CORRECTNESS, 0, context);

        LensReport again = runner.run(LensPrompts.CORRECTNESS, 0, context);

        assertEquals(LensStatus.COMPLETED, again.status());
        assertEquals("- [low] a.py: rename x\n", again.output());
        assertEquals(1, fixture.adapter.requests().size());
    }
}
