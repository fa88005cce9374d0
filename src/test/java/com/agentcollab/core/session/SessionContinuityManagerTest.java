package com.agentcollab.core.session;

import com.agentcollab.adapter.ToolResponse;
import com.agentcollab.config.CollabProperties;
import com.agentcollab.core.events.EventBus;
import com.agentcollab.core.metrics.CollabMetrics;
import com.agentcollab.core.model.CapabilityProbe;
import com.agentcollab.core.model.IdSource;
import com.agentcollab.core.model.SessionConfidence;
import com.agentcollab.core.model.SessionEvent;
import com.agentcollab.core.model.SessionMode;
import com.agentcollab.core.model.SessionRecord;
import com.agentcollab.core.model.SessionStatus;
import com.agentcollab.core.state.FileStateStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SessionContinuityManagerTest {

    private static final SessionMode FORCED = SessionMode.FORCED_WITHIN_PHASE;

    @TempDir
    Path taskDir;

    private FileStateStore store;
    private CollabProperties properties;
    private final AtomicInteger probes = new AtomicInteger();
    private IdSource idSource = IdSource.STRUCTURED_EVENT;
    private boolean resumeSupported = true;

    private SessionContinuityManager manager;

    @BeforeEach
    void setUp() {
        store = new FileStateStore(taskDir);
        properties = new CollabProperties();
        CapabilityProber prober = tool -> {
            probes.incrementAndGet();
            return new CapabilityProbe(tool, resumeSupported, idSource, true, "/usr/local/bin/" + tool,
                    resumeSupported ? "resume flag detected" : "no resume flag", Instant.now());
        };
        manager = new SessionContinuityManager(store, prober, new SessionIdExtractor(),
                new SessionLeaseRegistry(), properties, new EventBus(), new CollabMetrics(new SimpleMeterRegistry()));
    }

    private SessionRecord establishBaseline(String sessionId) {
        SessionDirective first = manager.beforeStage("impl", "codex", "codex_implement", FORCED);
        try {
            return manager.afterStage(first, ToolResponse.success("ok").withSessionId(sessionId)).orElseThrow();
        } finally {
            manager.release(first);
        }
    }

    @Nested
    @DisplayName("pre-stage decision")
    class BeforeStage {

        @Test
        @DisplayName("session mode off never probes or resumes")
        void modeOff() {
            SessionDirective directive = manager.beforeStage("impl", "codex", "codex_implement", SessionMode.OFF);

            assertFalse(directive.tracked());
            assertFalse(directive.leased());
            assertNull(directive.resumeSessionId());
            assertEquals(0, probes.get());
        }

        @Test
        @DisplayName("a tool without resume support runs fresh")
        void unsupported() {
            resumeSupported = false;

            SessionDirective directive = manager.beforeStage("impl", "gemini", "gemini_plan", FORCED);

            assertFalse(directive.tracked());
            assertFalse(directive.leased());
            assertNull(directive.resumeSessionId());
            assertTrue(manager.afterStage(directive, ToolResponse.success("ok").withSessionId("X")).isEmpty());
            assertTrue(store.readSession("impl", "gemini").isEmpty());
        }

        @Test
        @DisplayName("the probe result is cached per phase and tool")
        void probeCached() {
            manager.probe("impl", "codex");
            manager.probe("impl", "codex");
            manager.probe("review", "codex");

            assertEquals(2, probes.get());
            assertTrue(store.readProbe("impl", "codex").isPresent());
        }
    }

    @Nested
    @DisplayName("baseline and resume")
    class BaselineAndResume {

        @Test
        @DisplayName("the first stage of a phase records the baseline")
        void baseline() {
            SessionRecord record = establishBaseline("S1");

            assertEquals("S1", record.sessionId());
            assertEquals(SessionStatus.BASELINE, record.status());
            assertEquals(SessionConfidence.HIGH, record.confidence());
            assertEquals(record, store.readSession("impl", "codex").orElseThrow());
            assertTrue(store.readSessionEvents().stream().map(SessionEvent::event).anyMatch("session_baseline"::equals));
        }

        @Test
        @DisplayName("later stages resume the baseline and a matching id activates it")
        void resumeValidated() {
            establishBaseline("S1");

            SessionDirective next = manager.beforeStage("impl", "codex", "codex_fix", FORCED);
            assertEquals("S1", next.resumeSessionId());
            assertTrue(next.resuming());

            SessionRecord active = manager.afterStage(next, ToolResponse.success("ok").withSessionId("S1")).orElseThrow();
            manager.release(next);

            assertEquals(SessionStatus.ACTIVE, active.status());
            assertEquals(SessionStatus.ACTIVE, store.readSession("impl", "codex").orElseThrow().status());
        }

        @Test
        @DisplayName("another phase gets its own baseline")
        void phasesAreIndependent() {
            establishBaseline("S1");

            SessionDirective review = manager.beforeStage("review", "codex", "codex_review", FORCED);
            manager.release(review);

            assertNull(review.resumeSessionId());
        }

        @Test
        @DisplayName("without an extractable id no baseline is recorded")
        void noIdNoBaseline() {
            SessionDirective first = manager.beforeStage("impl", "codex", "codex_implement", FORCED);
            assertTrue(manager.afterStage(first, ToolResponse.success("ok")).isEmpty());
            manager.release(first);

            assertTrue(store.readSession("impl", "codex").isEmpty());
        }
    }

    @Nested
    @DisplayName("mismatch")
    class Mismatch {

        @Test
        @DisplayName("a different id stops with a recovery document and keeps the baseline")
        void differentId() {
            establishBaseline("S1");
            SessionDirective next = manager.beforeStage("impl", "codex", "codex_verify", FORCED);

            SessionMismatchException e = assertThrows(SessionMismatchException.class,
                    () -> manager.afterStage(next, ToolResponse.success("ok").withSessionId("S2")));
            manager.release(next);

            assertEquals("S1", e.getExpectedSessionId());
            assertEquals("S2", e.getActualSessionId());
            String recovery = store.readDocument(SessionContinuityManager.RECOVERY_DOCUMENT).orElseThrow();
            assertTrue(recovery.contains("Expected session ID: S1"));
            assertTrue(recovery.contains("Actual session ID: S2"));
            assertTrue(recovery.contains("sessions/impl/codex.json"));
            assertEquals("S1", store.readSession("impl", "codex").orElseThrow().sessionId());
        }

        @Test
        @DisplayName("a missing id while continuity is required is a mismatch")
        void missingId() {
            establishBaseline("S1");
            SessionDirective next = manager.beforeStage("impl", "codex", "codex_fix", FORCED);

            SessionMismatchException e = assertThrows(SessionMismatchException.class,
                    () -> manager.afterStage(next, ToolResponse.success("ok")));
            manager.release(next);

            assertNull(e.getActualSessionId());
            assertTrue(store.readDocument(SessionContinuityManager.RECOVERY_DOCUMENT).orElseThrow()
                    .contains("Actual session ID: <none>"));
        }
    }

    @Test
    @DisplayName("two stages may not hold one phase session at once")
    void concurrentResume() {
        SessionDirective holder = manager.beforeStage("impl", "codex", "codex_implement", FORCED);

        assertThrows(ConcurrentResumeException.class,
                () -> manager.beforeStage("impl", "codex", "codex_fix", FORCED));

        manager.release(holder);
        SessionDirective next = manager.beforeStage("impl", "codex", "codex_fix", FORCED);
        assertTrue(next.leased());
        manager.release(next);
    }

    @Test
    @DisplayName("state directory diffs establish a medium-confidence baseline")
    void stateDirDiff(@TempDir Path stateDir) throws IOException {
        idSource = IdSource.STATE_DIR_DIFF;
        CollabProperties.Tool claude = new CollabProperties.Tool();
        claude.setStateDir(stateDir.toString());
        properties.getTools().put("claude", claude);

        SessionDirective first = manager.beforeStage("impl", "claude", "claude_plan", FORCED);
        Files.writeString(stateDir.resolve("9b1deb4d-3b7d-4bad-9bdd-2b0d7b3dcb6d.jsonl"), "{}");
        SessionRecord record = manager.afterStage(first, ToolResponse.success("ok")).orElseThrow();
        manager.release(first);

        assertEquals("9b1deb4d-3b7d-4bad-9bdd-2b0d7b3dcb6d", record.sessionId());
        assertEquals(IdSource.STATE_DIR_DIFF, record.source());
        assertEquals(SessionConfidence.MEDIUM, record.confidence());
    }
}
