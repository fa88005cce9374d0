package com.agentcollab.adapter;

import com.agentcollab.config.CollabProperties;
import com.agentcollab.core.model.DeadlineMode;
import com.agentcollab.core.model.ToolExitStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a tool as a local process. The prompt is written to stdin on a background thread while
 * the deadline runs; stdout becomes the artifact (and the event log used for session
 * extraction) and stderr the diagnostics.
 * <p>
 * Exit codes are normalized: 127 and wrapper codes 10/30 mean a missing binary, 2/11/31 missing
 * input, 13/33/124 a timeout and 14 an oversized input.
 */
@Component
public class ProcessToolAdapter implements ToolAdapter {

    private static final Logger log = LoggerFactory.getLogger(ProcessToolAdapter.class);

    static final int EXIT_TIMEOUT = 124;
    static final int EXIT_MISSING_BINARY = 127;

    private final CollabProperties properties;
    private final ExecutorService streamReaders = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "tool-stream-reader");
        t.setDaemon(true);
        return t;
    });

    public ProcessToolAdapter(CollabProperties properties) {
        this.properties = properties;
    }

    @Override
    public ToolResponse invoke(ToolRequest request) throws InterruptedException {
        List<String> command = buildCommand(request);
        log.info("Invoking {} for stage {} (resume={})", request.tool(), request.stageId(),
                request.resumeSessionId() != null ? request.resumeSessionId() : "fresh");

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .redirectErrorStream(false)
                    .start();
        } catch (IOException e) {
            log.warn("Could not start {}: {}", command.get(0), e.getMessage());
            return ToolResponse.failure(ToolExitStatus.MISSING_BINARY, EXIT_MISSING_BINARY,
                    command.get(0) + ": command not found (" + e.getMessage() + ")");
        }

        CompletableFuture<String> stdout = readAsync(process.getInputStream());
        CompletableFuture<String> stderr = readAsync(process.getErrorStream());
        // a tool that never drains stdin must not hold off the deadline
        CompletableFuture<Boolean> promptWritten =
                CompletableFuture.supplyAsync(() -> writePrompt(process, request.prompt()), streamReaders);

        try {
            boolean finished;
            if (request.deadlineMode() == DeadlineMode.ENFORCE && request.deadline() != null) {
                finished = process.waitFor(request.deadline().toMillis(), TimeUnit.MILLISECONDS);
            } else {
                process.waitFor();
                finished = true;
            }

            if (!finished) {
                process.destroyForcibly();
                log.warn("{} exceeded deadline {} for stage {}", request.tool(), request.deadline(), request.stageId());
                String err = collect(stderr);
                return new ToolResponse(collect(stdout),
                        err + "\ntimeout: deadline of " + request.deadline().toSeconds() + "s exceeded",
                        ToolExitStatus.TIMEOUT, EXIT_TIMEOUT, null, null);
            }

            int exitCode = process.exitValue();
            String out = collect(stdout);
            String err = collect(stderr);
            if (!promptWritten.getNow(true)) {
                log.warn("{} exited before reading the full prompt for stage {}", request.tool(), request.stageId());
                err = err + "\nstdin closed before the full prompt was written";
            }
            return new ToolResponse(out, err, normalizeExitCode(exitCode), exitCode, null, out);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
    }

    List<String> buildCommand(ToolRequest request) {
        CollabProperties.Tool tool = properties.tool(request.tool());
        List<String> command = new ArrayList<>(tool.getCommand());
        if (command.isEmpty()) {
            command.add(request.tool());
        }
        if (request.model() != null && !request.model().isBlank()) {
            for (String arg : tool.getModelArgs()) {
                command.add(arg.replace("{model}", request.model()));
            }
        }
        if (request.resumeSessionId() != null) {
            for (String arg : tool.getResumeArgs()) {
                command.add(arg.replace("{session}", request.resumeSessionId()));
            }
        }
        return command;
    }

    static ToolExitStatus normalizeExitCode(int exitCode) {
        return switch (exitCode) {
            case 0 -> ToolExitStatus.SUCCESS;
            case 10, 30, EXIT_MISSING_BINARY -> ToolExitStatus.MISSING_BINARY;
            case 2, 11, 31 -> ToolExitStatus.MISSING_INPUT;
            case 13, 33, EXIT_TIMEOUT -> ToolExitStatus.TIMEOUT;
            case 14 -> ToolExitStatus.INPUT_TOO_LARGE;
            default -> ToolExitStatus.GENERAL_FAILURE;
        };
    }

    /**
     * @return false when the tool closed stdin before the whole prompt was written
     */
    private boolean writePrompt(Process process, String prompt) {
        try (OutputStream stdin = process.getOutputStream()) {
            if (prompt != null) {
                stdin.write(prompt.getBytes(StandardCharsets.UTF_8));
            }
            return true;
        } catch (IOException e) {
            log.debug("Tool closed stdin early: {}", e.getMessage());
            return false;
        }
    }

    private CompletableFuture<String> readAsync(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (stream) {
                return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                return "";
            }
        }, streamReaders);
    }

    private static String collect(CompletableFuture<String> future) throws InterruptedException {
        try {
            return future.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Tool stream not fully captured: {}", e.getMessage());
            return "";
        }
    }
}
