package com.agentcollab.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * One line of the append-only session audit log.
 *
 * @param event     event name (phase_init, session_baseline, session_mismatch, ...)
 * @param phase     phase scope
 * @param tool      tool, nullable for phase-level events
 * @param stage     stage, nullable for phase-level events
 * @param sessionId session involved, nullable
 * @param details   extra key-value data
 * @param at        when the event happened
 */
public record SessionEvent(
    String event,
    String phase,
    String tool,
    String stage,
    String sessionId,
    Map<String, String> details,
    Instant at
) implements Serializable {

    public SessionEvent {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
