package com.agentcollab.adapter;

import com.agentcollab.config.CollabProperties;
import com.agentcollab.core.model.DeadlineMode;
import com.agentcollab.core.model.ToolExitStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcessToolAdapterTest {

    private CollabProperties properties;
    private ProcessToolAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new CollabProperties();
        adapter = new ProcessToolAdapter(properties);
    }

    private void configure(String name, List<String> command) {
        CollabProperties.Tool tool = new CollabProperties.Tool();
        tool.setCommand(command);
        tool.setModelArgs(List.of("--model", "{model}"));
        tool.setResumeArgs(List.of("resume", "{session}"));
        properties.getTools().put(name, tool);
    }

    private static ToolRequest request(String tool, String prompt, Duration deadline, String resume) {
        return new ToolRequest(tool + "_implement", tool, prompt, null, null, deadline, DeadlineMode.ENFORCE, resume);
    }

    @ParameterizedTest
    @CsvSource({
            "0, SUCCESS",
            "127, MISSING_BINARY",
            "10, MISSING_BINARY",
            "30, MISSING_BINARY",
            "2, MISSING_INPUT",
            "31, MISSING_INPUT",
            "124, TIMEOUT",
            "13, TIMEOUT",
            "14, INPUT_TOO_LARGE",
            "1, GENERAL_FAILURE",
            "255, GENERAL_FAILURE"
    })
    @DisplayName("normalizes raw exit codes")
    void normalizeExitCode(int exitCode, ToolExitStatus expected) {
        assertEquals(expected, ProcessToolAdapter.normalizeExitCode(exitCode));
    }

    @Nested
    @DisplayName("command line")
    class CommandLine {

        @Test
        @DisplayName("adds model and resume arguments only when set")
        void modelAndResume() {
            configure("codex", List.of("codex", "exec", "--json"));
            ToolRequest resumed = new ToolRequest("codex_fix", "codex", "p", "gpt-5", null,
                    Duration.ofMinutes(1), DeadlineMode.ENFORCE, "S1");

            assertEquals(List.of("codex", "exec", "--json", "--model", "gpt-5", "resume", "S1"),
                    adapter.buildCommand(resumed));
            assertEquals(List.of("codex", "exec", "--json"),
                    adapter.buildCommand(request("codex", "p", Duration.ofMinutes(1), null)));
        }

        @Test
        @DisplayName("an unconfigured tool runs under its own name")
        void unconfigured() {
            assertEquals(List.of("gemini"), adapter.buildCommand(request("gemini", "p", null, null)));
        }
    }

    @Nested
    @DisplayName("process execution")
    class Execution {

        @Test
        @DisplayName("a binary that cannot start is reported as missing")
        void missingBinary() throws InterruptedException {
            configure("ghost", List.of("agentcollab-no-such-binary-7f3a"));

            ToolResponse response = adapter.invoke(request("ghost", "p", Duration.ofSeconds(5), null));

            assertEquals(ToolExitStatus.MISSING_BINARY, response.exitStatus());
            assertEquals(127, response.exitCode());
            assertTrue(response.diagnostics().contains("command not found"));
        }

        @Test
        @EnabledOnOs({OS.LINUX, OS.MAC})
        @DisplayName("the prompt goes to stdin and both streams are captured")
        void streams() throws InterruptedException {
            configure("echo", List.of("sh", "-c", "cat; echo 'context window exceeded' >&2; exit 14"));

            ToolResponse response = adapter.invoke(request("echo", "hello tool", Duration.ofSeconds(10), null));

            assertEquals(ToolExitStatus.INPUT_TOO_LARGE, response.exitStatus());
            assertEquals(14, response.exitCode());
            assertEquals("hello tool", response.artifact());
            assertEquals("hello tool", response.eventLog());
            assertTrue(response.diagnostics().contains("context window exceeded"));
        }

        @Test
        @EnabledOnOs({OS.LINUX, OS.MAC})
        @DisplayName("an enforced deadline kills the process")
        void deadline() throws InterruptedException {
            configure("slow", List.of("sh", "-c", "exec sleep 30"));

            long start = System.nanoTime();
            ToolResponse response = adapter.invoke(request("slow", "", Duration.ofMillis(300), null));

            assertEquals(ToolExitStatus.TIMEOUT, response.exitStatus());
            assertEquals(124, response.exitCode());
            assertTrue(response.diagnostics().contains("deadline"));
            assertTrue(Duration.ofNanos(System.nanoTime() - start).toSeconds() < 10);
        }

        @Test
        @EnabledOnOs({OS.LINUX, OS.MAC})
        @DisplayName("a prompt larger than the pipe buffer cannot hold off the deadline")
        void deadlineWithUnreadPrompt() throws InterruptedException {
            configure("deaf", List.of("sh", "-c", "exec sleep 30"));
            String prompt = "x".repeat(1024 * 1024);

            long start = System.nanoTime();
            ToolResponse response = adapter.invoke(request("deaf", prompt, Duration.ofMillis(500), null));

            assertEquals(ToolExitStatus.TIMEOUT, response.exitStatus());
            assertEquals(124, response.exitCode());
            assertTrue(Duration.ofNanos(System.nanoTime() - start).toSeconds() < 10);
        }
    }
}
