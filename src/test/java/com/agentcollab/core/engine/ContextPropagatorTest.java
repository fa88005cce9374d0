package com.agentcollab.core.engine;

import com.agentcollab.core.state.FileStateStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ContextPropagatorTest {

    private static final String BRIEF = """
            # Brief

            Some preamble the next stages do not need.

            ## Updated Context Pack

            ## 1. Goal
            Rate-limit the login endpoint.

            ## 2. Constraints
            - no new dependencies

            ## Verify Commands
            ```bash
            pytest -q tests/test_login.py

            ruff check .
            ```

            ## Notes
            trailing section
            """;

    @Nested
    @DisplayName("context pack extraction")
    class ContextPack {

        @Test
        @DisplayName("keeps the numbered sections after the heading")
        void numberedSections() {
            String pack = ContextPropagator.extractContextPack(BRIEF).orElseThrow();

            assertTrue(pack.startsWith("## 1. Goal\n"));
            assertTrue(pack.contains("## 2. Constraints\n- no new dependencies"));
            assertFalse(pack.contains("preamble"));
            assertFalse(pack.contains("Verify Commands"));
            assertTrue(pack.endsWith("dependencies\n"));
        }

        @Test
        @DisplayName("is empty without the heading or without numbered sections")
        void missing() {
            assertEquals(Optional.empty(), ContextPropagator.extractContextPack("## 1. Goal\nx\n"));
            assertEquals(Optional.empty(), ContextPropagator.extractContextPack("## Updated Context Pack\n## Notes\n"));
        }
    }

    @Test
    @DisplayName("verify commands come from the fenced block")
    void verifyCommands() {
        assertEquals(List.of("pytest -q tests/test_login.py", "ruff check ."),
                ContextPropagator.extractVerifyCommands(BRIEF));
        assertTrue(ContextPropagator.extractVerifyCommands("## Verify Commands\nnone\n## Next\n").isEmpty());
    }

    @Test
    @DisplayName("a brief without verify commands clears a stale override")
    void clearsOverride(@TempDir Path taskDir) {
        FileStateStore store = new FileStateStore(taskDir);
        ContextPropagator propagator = new ContextPropagator(store);
        store.writeDocument(ContextPropagator.ACCEPTANCE_OVERRIDE, "make test\n");

        propagator.propagate("claude_brief", "## Updated Context Pack\n## 1. Goal\nx\n");

        assertTrue(store.readDocument(ContextPropagator.ACCEPTANCE_OVERRIDE).isEmpty());
        assertEquals("## 1. Goal\nx\n", store.readDocument(ContextPropagator.CONTEXT_PACK).orElseThrow());
        assertTrue(propagator.mutatesContext("brief"));
        assertFalse(propagator.mutatesContext("implement"));
    }
}
