package com.agentcollab.core.state;

import com.agentcollab.core.model.CapabilityProbe;
import com.agentcollab.core.model.LastFailure;
import com.agentcollab.core.model.RunStats;
import com.agentcollab.core.model.SessionEvent;
import com.agentcollab.core.model.SessionRecord;
import com.agentcollab.core.model.StageRun;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * {@link StateStore} backed by a task directory.
 * <pre>
 * state/stats.json                      budget and signature counters
 * state/last_failure.json               most recent failure
 * state/session-probe/&lt;phase&gt;/&lt;tool&gt;.json  capability probe cache
 * state/session-events.jsonl            session audit log
 * sessions/&lt;phase&gt;/&lt;tool&gt;.json          session records
 * done/&lt;stage&gt;.done                      done-markers
 * outputs/&lt;stage&gt;.&lt;tool&gt;.{out,err,meta.json}
 * </pre>
 * Files are written to a {@code .partial} sibling and renamed into place.
 */
public class FileStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(FileStateStore.class);

    private static final String STATS_FILE = "state/stats.json";
    private static final String STATS_LOCK_FILE = "state/stats.lock";
    private static final String LAST_FAILURE_FILE = "state/last_failure.json";
    private static final String SESSION_EVENTS_FILE = "state/session-events.jsonl";

    private final Path root;
    private final ObjectMapper objectMapper;
    private final ReentrantLock statsLock = new ReentrantLock();
    private final Object eventLogMonitor = new Object();

    public FileStateStore(Path root) {
        this(root, createObjectMapper());
    }

    public FileStateStore(Path root, ObjectMapper objectMapper) {
        this.root = root.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
    }

    /**
     * Mapper used for every persisted file: snake_case keys, ISO-8601 timestamps,
     * tolerant of fields added by newer versions.
     */
    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Path root() {
        return root;
    }

    // -- Stats ------------------------------------------------------------------

    @Override
    public RunStats loadStats() {
        return readJson(STATS_FILE, RunStats.class).orElseGet(RunStats::empty);
    }

    @Override
    public RunStats updateStats(UnaryOperator<RunStats> mutation) {
        statsLock.lock();
        try {
            Path lockPath = resolve(STATS_LOCK_FILE);
            createParent(lockPath);
            try (FileChannel channel = FileChannel.open(lockPath,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                RunStats updated = mutation.apply(loadStats());
                writeJson(STATS_FILE, updated);
                return updated;
            }
        } catch (IOException e) {
            throw new StateStoreException("Failed to update " + STATS_FILE, e);
        } finally {
            statsLock.unlock();
        }
    }

    // -- Stage markers and outputs ------------------------------------------------

    @Override
    public boolean hasDoneMarker(String stageId) {
        return Files.isRegularFile(resolve(doneMarkerPath(stageId)));
    }

    @Override
    public void writeDoneMarker(String stageId, Instant at) {
        writeDocument(doneMarkerPath(stageId), at.toString() + "\n");
    }

    @Override
    public void writeStageRun(StageRun run) {
        writeJson(outputPath(run.stageId(), run.tool(), "meta.json"), run);
    }

    @Override
    public Optional<StageRun> readStageRun(String stageId, String tool) {
        return readJson(outputPath(stageId, tool, "meta.json"), StageRun.class);
    }

    @Override
    public void writeStageOutput(String stageId, String tool, String artifact, String diagnostics) {
        writeDocument(outputPath(stageId, tool, "out"), artifact == null ? "" : artifact);
        writeDocument(outputPath(stageId, tool, "err"), diagnostics == null ? "" : diagnostics);
    }

    @Override
    public Optional<String> readStageDiagnostics(String stageId, String tool) {
        return readDocument(outputPath(stageId, tool, "err"));
    }

    // -- Sessions -------------------------------------------------------------------

    @Override
    public Optional<SessionRecord> readSession(String phase, String tool) {
        return readJson(sessionPath(phase, tool), SessionRecord.class);
    }

    @Override
    public void writeSession(SessionRecord record) {
        writeJson(sessionPath(record.phase(), record.tool()), record);
    }

    @Override
    public Optional<CapabilityProbe> readProbe(String phase, String tool) {
        return readJson(probePath(phase, tool), CapabilityProbe.class);
    }

    @Override
    public void writeProbe(String phase, CapabilityProbe probe) {
        writeJson(probePath(phase, probe.tool()), probe);
    }

    @Override
    public void appendSessionEvent(SessionEvent event) {
        Path path = resolve(SESSION_EVENTS_FILE);
        synchronized (eventLogMonitor) {
            try {
                createParent(path);
                String line = objectMapper.writer()
                        .without(SerializationFeature.INDENT_OUTPUT)
                        .writeValueAsString(event) + "\n";
                Files.writeString(path, line, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new StateStoreException("Failed to append session event to " + path, e);
            }
        }
    }

    @Override
    public List<SessionEvent> readSessionEvents() {
        Optional<String> content = readDocument(SESSION_EVENTS_FILE);
        List<SessionEvent> events = new ArrayList<>();
        if (content.isEmpty()) {
            return events;
        }
        for (String line : content.get().split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                events.add(objectMapper.readValue(line, SessionEvent.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable session event line: {}", e.getOriginalMessage());
            }
        }
        return events;
    }

    // -- Failures -------------------------------------------------------------------

    @Override
    public void writeLastFailure(LastFailure failure) {
        writeJson(LAST_FAILURE_FILE, failure);
    }

    @Override
    public Optional<LastFailure> readLastFailure() {
        return readJson(LAST_FAILURE_FILE, LastFailure.class);
    }

    // -- Generic documents ------------------------------------------------------------

    @Override
    public void writeDocument(String relativePath, String content) {
        writeAtomically(resolve(relativePath), content.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public Optional<String> readDocument(String relativePath) {
        Path path = resolve(relativePath);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new StateStoreException("Failed to read " + path, e);
        }
    }

    @Override
    public void deleteDocument(String relativePath) {
        Path path = resolve(relativePath);
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new StateStoreException("Failed to delete " + path, e);
        }
    }

    @Override
    public void writeJson(String relativePath, Object value) {
        try {
            writeAtomically(resolve(relativePath), objectMapper.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Failed to serialize " + relativePath, e);
        }
    }

    private <T> Optional<T> readJson(String relativePath, Class<T> type) {
        Path path = resolve(relativePath);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(path.toFile(), type));
        } catch (IOException e) {
            throw new StateStoreException("Failed to read " + path, e);
        }
    }

    private void writeAtomically(Path target, byte[] content) {
        try {
            createParent(target);
            Path partial = Files.createTempFile(target.getParent(),
                    target.getFileName().toString() + ".", ".partial");
            try {
                Files.write(partial, content);
                try {
                    Files.move(partial, target, StandardCopyOption.ATOMIC_MOVE,
                            StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(partial);
            }
        } catch (IOException e) {
            throw new StateStoreException("Failed to write " + target, e);
        }
    }

    private Path resolve(String relativePath) {
        Path resolved = root.resolve(relativePath).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes task root: " + relativePath);
        }
        return resolved;
    }

    private static void createParent(Path path) throws IOException {
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static String doneMarkerPath(String stageId) {
        return "done/" + stageId + ".done";
    }

    private static String outputPath(String stageId, String tool, String suffix) {
        return "outputs/" + stageId + "." + tool + "." + suffix;
    }

    private static String sessionPath(String phase, String tool) {
        return "sessions/" + phase + "/" + tool + ".json";
    }

    private static String probePath(String phase, String tool) {
        return "state/session-probe/" + phase + "/" + tool + ".json";
    }
}
