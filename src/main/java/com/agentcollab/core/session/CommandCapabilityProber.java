package com.agentcollab.core.session;

import com.agentcollab.config.CollabProperties;
import com.agentcollab.core.model.CapabilityProbe;
import com.agentcollab.core.model.IdSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Probes a tool by locating its binary on {@code PATH} and running the configured probe
 * arguments (typically a help command). Resume is supported when the probe exits 0 and, if a
 * probe marker is configured, its output mentions the marker.
 */
@Component
public class CommandCapabilityProber implements CapabilityProber {

    private static final Logger log = LoggerFactory.getLogger(CommandCapabilityProber.class);

    private static final long PROBE_TIMEOUT_SECONDS = 15;

    private final CollabProperties properties;

    public CommandCapabilityProber(CollabProperties properties) {
        this.properties = properties;
    }

    @Override
    public CapabilityProbe probe(String tool) {
        CollabProperties.Tool config = properties.tool(tool);
        String binary = config.getCommand().isEmpty() ? tool : config.getCommand().get(0);

        Optional<Path> binaryPath = locate(binary);
        if (binaryPath.isEmpty()) {
            return unsupported(tool, false, null, binary + " binary not found in PATH");
        }
        if (config.getResumeArgs().isEmpty()) {
            return unsupported(tool, true, binaryPath.get(), "no resume arguments configured for " + tool);
        }
        IdSource idSource = IdSource.fromLabel(config.getIdSource());
        if (idSource == IdSource.NONE) {
            return unsupported(tool, true, binaryPath.get(), "no session id source configured for " + tool);
        }
        if (config.getProbeArgs().isEmpty()) {
            return new CapabilityProbe(tool, true, idSource, true, binaryPath.get().toString(),
                    "resume support declared by configuration", Instant.now());
        }

        List<String> command = new ArrayList<>();
        command.add(binaryPath.get().toString());
        command.addAll(config.getProbeArgs());
        try {
            var process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .start();
            process.getOutputStream().close();
            if (!process.waitFor(PROBE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return unsupported(tool, true, binaryPath.get(), "probe timed out: " + String.join(" ", command));
            }
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                return unsupported(tool, true, binaryPath.get(),
                        "probe returned non-zero (" + process.exitValue() + "): " + String.join(" ", command));
            }
            String marker = config.getProbeMarker();
            if (marker != null && !marker.isBlank() && !output.contains(marker)) {
                return unsupported(tool, true, binaryPath.get(), marker + " not found in probe output");
            }
            log.info("Probe: {} supports resume (id source {})", tool, idSource);
            return new CapabilityProbe(tool, true, idSource, true, binaryPath.get().toString(),
                    "probe passed: " + String.join(" ", config.getProbeArgs()), Instant.now());
        } catch (IOException e) {
            return unsupported(tool, true, binaryPath.get(), "probe failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return unsupported(tool, true, binaryPath.get(), "probe interrupted");
        }
    }

    static Optional<Path> locate(String binary) {
        Path direct = Path.of(binary);
        if (binary.contains(File.separator)) {
            return Files.isExecutable(direct) ? Optional.of(direct.toAbsolutePath()) : Optional.empty();
        }
        String pathEnv = System.getenv("PATH");
        if (pathEnv == null) {
            return Optional.empty();
        }
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Path.of(dir, binary);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static CapabilityProbe unsupported(String tool, boolean found, Path path, String notes) {
        log.info("Probe: {} has no resume support ({})", tool, notes);
        return new CapabilityProbe(tool, false, IdSource.NONE, found,
                path != null ? path.toString() : null, notes, Instant.now());
    }
}
