package com.agentcollab.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while stages and reviews run, used for CLI progress output.
 *
 * @param eventType event type (e.g. "stage.started", "stage.progress", "review.lens.completed")
 * @param phase     the phase this event belongs to
 * @param stageId   the stage or lens this event relates to (nullable for phase-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record CollabEvent(
    String eventType,
    String phase,
    String stageId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static CollabEvent of(String eventType, String phase, String stageId, Map<String, Object> payload) {
        return new CollabEvent(eventType, phase, stageId, payload, Instant.now());
    }
}
