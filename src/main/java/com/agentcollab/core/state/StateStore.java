package com.agentcollab.core.state;

import com.agentcollab.core.model.CapabilityProbe;
import com.agentcollab.core.model.LastFailure;
import com.agentcollab.core.model.RunStats;
import com.agentcollab.core.model.SessionEvent;
import com.agentcollab.core.model.SessionRecord;
import com.agentcollab.core.model.StageRun;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Persisted state of a single task: budget and signature counters, stage markers and meta
 * records, session records, probe cache, failure records and review artifacts.
 * <p>
 * Every write is committed atomically. {@link #updateStats} is a read-modify-write that is safe
 * against concurrent writers in the same JVM and in other processes sharing the task directory.
 */
public interface StateStore {

    /** Root directory of the task. */
    Path root();

    RunStats loadStats();

    /**
     * Applies {@code mutation} to the current stats and commits the result atomically.
     *
     * @return the committed stats
     */
    RunStats updateStats(UnaryOperator<RunStats> mutation);

    boolean hasDoneMarker(String stageId);

    void writeDoneMarker(String stageId, Instant at);

    void writeStageRun(StageRun run);

    Optional<StageRun> readStageRun(String stageId, String tool);

    void writeStageOutput(String stageId, String tool, String artifact, String diagnostics);

    Optional<String> readStageDiagnostics(String stageId, String tool);

    Optional<SessionRecord> readSession(String phase, String tool);

    void writeSession(SessionRecord record);

    Optional<CapabilityProbe> readProbe(String phase, String tool);

    void writeProbe(String phase, CapabilityProbe probe);

    void writeLastFailure(LastFailure failure);

    Optional<LastFailure> readLastFailure();

    void appendSessionEvent(SessionEvent event);

    List<SessionEvent> readSessionEvents();

    /** Atomically writes a text document at a path relative to the task root. */
    void writeDocument(String relativePath, String content);

    Optional<String> readDocument(String relativePath);

    void deleteDocument(String relativePath);

    /** Atomically writes a value as JSON at a path relative to the task root. */
    void writeJson(String relativePath, Object value);
}
