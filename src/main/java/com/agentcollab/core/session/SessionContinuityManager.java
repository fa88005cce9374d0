package com.agentcollab.core.session;

import com.agentcollab.adapter.ToolResponse;
import com.agentcollab.config.CollabProperties;
import com.agentcollab.core.events.CollabEvent;
import com.agentcollab.core.events.EventBus;
import com.agentcollab.core.metrics.CollabMetrics;
import com.agentcollab.core.model.CapabilityProbe;
import com.agentcollab.core.model.IdSource;
import com.agentcollab.core.model.SessionEvent;
import com.agentcollab.core.model.SessionMode;
import com.agentcollab.core.model.SessionRecord;
import com.agentcollab.core.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps one tool session per (phase, tool) alive across the stages of a phase.
 * <p>
 * The first stage of a phase establishes the baseline. Later stages resume it, and the id the
 * tool reports afterwards must equal the baseline or the pipeline stops with a recovery
 * document. Only one stage at a time may hold a (phase, tool) session.
 */
@Service
public class SessionContinuityManager {

    private static final Logger log = LoggerFactory.getLogger(SessionContinuityManager.class);

    static final String RECOVERY_DOCUMENT = "state/session_recovery.md";

    private final StateStore stateStore;
    private final CapabilityProber prober;
    private final SessionIdExtractor extractor;
    private final SessionLeaseRegistry leases;
    private final CollabProperties properties;
    private final EventBus eventBus;
    private final CollabMetrics metrics;

    public SessionContinuityManager(StateStore stateStore, CapabilityProber prober,
                                    SessionIdExtractor extractor, SessionLeaseRegistry leases,
                                    CollabProperties properties, EventBus eventBus,
                                    CollabMetrics metrics) {
        this.stateStore = stateStore;
        this.prober = prober;
        this.extractor = extractor;
        this.leases = leases;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Returns the cached probe for (phase, tool), probing and caching on first use.
     */
    public CapabilityProbe probe(String phase, String tool) {
        return stateStore.readProbe(phase, tool).orElseGet(() -> {
            CapabilityProbe probe = prober.probe(tool);
            stateStore.writeProbe(phase, probe);
            return probe;
        });
    }

    /**
     * Decides whether the stage resumes the phase baseline or runs fresh.
     *
     * @throws ConcurrentResumeException if another stage is using the (phase, tool) session
     */
    public SessionDirective beforeStage(String phase, String tool, String stageId, SessionMode mode) {
        if (mode == SessionMode.OFF) {
            return SessionDirective.fresh(phase, tool, stageId, mode);
        }

        CapabilityProbe probe = probe(phase, tool);
        if (!probe.resumeSupported()) {
            log.warn("{} does not support resume ({}); stage {} runs fresh", tool, probe.notes(), stageId);
            return new SessionDirective(phase, tool, stageId, mode, probe, null, null, null, false);
        }

        leases.acquire(phase, tool, stageId);
        try {
            SessionRecord baseline = stateStore.readSession(phase, tool).orElse(null);
            StateDirSnapshot snapshot = null;
            if (probe.idSource() == IdSource.STATE_DIR_DIFF) {
                snapshot = extractor.snapshot(stateDir(tool));
            }

            if (baseline == null) {
                log.info("No {} baseline for phase {}; stage {} establishes it", tool, phase, stageId);
                return new SessionDirective(phase, tool, stageId, mode, probe, null, null, snapshot, true);
            }

            log.info("Stage {} resumes {} session {}", stageId, tool, baseline.sessionId());
            recordEvent("stage_resume", phase, tool, stageId, baseline.sessionId(), Map.of());
            return new SessionDirective(phase, tool, stageId, mode, probe, baseline,
                    baseline.sessionId(), snapshot, true);
        } catch (RuntimeException e) {
            leases.release(phase, tool, stageId);
            throw e;
        }
    }

    /**
     * Validates the session a successful call used against the baseline.
     *
     * @return the recorded or validated session, empty when the call is not tracked or no
     *         baseline could be established
     * @throws SessionMismatchException when a baseline exists and the call did not continue it
     */
    public Optional<SessionRecord> afterStage(SessionDirective directive, ToolResponse response) {
        if (!directive.tracked()) {
            return Optional.empty();
        }

        SessionExtraction extraction = extract(directive, response);
        SessionRecord baseline = directive.baseline();
        Instant now = Instant.now();

        if (!extraction.isFound()) {
            if (baseline != null) {
                throw mismatch(directive, null,
                        "Session id could not be extracted while continuity was required: "
                                + extraction.failureReason());
            }
            log.warn("Could not extract {} session id for stage {}: {}; no baseline recorded",
                    directive.tool(), directive.stageId(), extraction.failureReason());
            return Optional.empty();
        }

        String actual = extraction.sessionId();
        if (baseline == null) {
            SessionRecord created = SessionRecord.baseline(directive.phase(), directive.tool(), actual,
                    directive.probe().idSource(), now);
            stateStore.writeSession(created);
            recordEvent("session_baseline", directive.phase(), directive.tool(), directive.stageId(), actual,
                    Map.of("confidence", created.confidence().name()));
            log.info("Recorded {} baseline session {} for phase {}", directive.tool(), actual, directive.phase());
            return Optional.of(created);
        }

        if (!baseline.sessionId().equals(actual)) {
            throw mismatch(directive, actual, "Resumed call returned a different session id");
        }

        SessionRecord active = baseline.markActive(now);
        stateStore.writeSession(active);
        recordEvent("session_validated", directive.phase(), directive.tool(), directive.stageId(), actual, Map.of());
        return Optional.of(active);
    }

    public void release(SessionDirective directive) {
        if (directive.leased()) {
            leases.release(directive.phase(), directive.tool(), directive.stageId());
        }
    }

    public void recordPhaseEvent(String event, String phase, Map<String, String> details) {
        recordEvent(event, phase, null, null, null, details);
    }

    public void recordStageFailure(String phase, String tool, String stageId, String errorClass) {
        recordEvent("stage_failed", phase, tool, stageId, null, Map.of("class", errorClass));
    }

    private SessionExtraction extract(SessionDirective directive, ToolResponse response) {
        if (response.sessionId() != null && !response.sessionId().isBlank()) {
            return SessionExtraction.found(response.sessionId());
        }
        return switch (directive.probe().idSource()) {
            case STRUCTURED_EVENT -> extractor.fromEventLog(response.eventLog());
            case STATE_DIR_DIFF -> directive.snapshot() != null
                    ? extractor.fromStateDirDiff(directive.snapshot())
                    : SessionExtraction.failed("no state directory snapshot taken");
            case NONE -> SessionExtraction.failed("tool exposes no session id source");
        };
    }

    private SessionMismatchException mismatch(SessionDirective directive, String actual, String reason) {
        String expected = directive.baseline().sessionId();
        log.error("Session mismatch in phase {} for {} at stage {}: expected {}, got {}",
                directive.phase(), directive.tool(), directive.stageId(), expected, actual);
        writeRecoveryDocument(directive, actual, reason);

        Map<String, String> details = new LinkedHashMap<>();
        details.put("expected", expected);
        details.put("actual", actual == null ? "<none>" : actual);
        details.put("reason", reason);
        recordEvent("session_mismatch", directive.phase(), directive.tool(), directive.stageId(), actual, details);
        metrics.recordSessionMismatch(directive.tool());
        return new SessionMismatchException(directive.phase(), directive.tool(), directive.stageId(),
                expected, actual, reason);
    }

    private void writeRecoveryDocument(SessionDirective directive, String actual, String reason) {
        String doc = """
                # Session Recovery Required

                Generated: %s
                Phase: %s
                Tool: %s
                Stage: %s

                ## Reason

                %s

                ## Session Values

                - Expected session ID: %s
                - Actual session ID: %s
                - Resume target: %s

                ## Recovery Procedure (Required)

                1. Re-run the capability probe and confirm resume support for this tool.
                2. Inspect the tool's session candidates and decide which ID is the correct continuation.
                3. Update the phase session record at sessions/%s/%s.json.
                4. Resume the same phase from the failed stage.
                5. Do not continue with a fresh session for this phase unless the session mode is changed.
                """.formatted(Instant.now(), directive.phase(), directive.tool(), directive.stageId(), reason,
                directive.baseline().sessionId(),
                actual == null ? "<none>" : actual,
                directive.resumeSessionId() == null ? "<none>" : directive.resumeSessionId(),
                directive.phase(), directive.tool());
        stateStore.writeDocument(RECOVERY_DOCUMENT, doc);
    }

    private void recordEvent(String event, String phase, String tool, String stageId, String sessionId,
                             Map<String, String> details) {
        stateStore.appendSessionEvent(new SessionEvent(event, phase, tool, stageId, sessionId, details, Instant.now()));
        Map<String, Object> payload = new LinkedHashMap<>(details);
        if (sessionId != null) {
            payload.put("sessionId", sessionId);
        }
        if (tool != null) {
            payload.put("tool", tool);
        }
        eventBus.publish(new CollabEvent("session." + event, phase, stageId, payload, Instant.now()));
    }

    private Path stateDir(String tool) {
        String dir = properties.tool(tool).getStateDir();
        return dir == null || dir.isBlank() ? null : Path.of(dir);
    }
}
