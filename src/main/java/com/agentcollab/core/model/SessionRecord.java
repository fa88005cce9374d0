package com.agentcollab.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * The baseline session of one (phase, tool) pair.
 *
 * @param phase      the phase scope
 * @param tool       the tool owning the session
 * @param sessionId  baseline session id
 * @param source     extraction mechanism that produced the id
 * @param confidence confidence derived from the extraction mechanism
 * @param status     baseline until the first validated resume, active afterwards
 * @param createdAt  when the baseline was recorded
 * @param lastUsedAt last stage that used the session
 */
public record SessionRecord(
    String phase,
    String tool,
    String sessionId,
    IdSource source,
    SessionConfidence confidence,
    SessionStatus status,
    Instant createdAt,
    Instant lastUsedAt
) implements Serializable {

    public static SessionRecord baseline(String phase, String tool, String sessionId,
                                         IdSource source, Instant at) {
        return new SessionRecord(phase, tool, sessionId, source, source.confidence(),
                SessionStatus.BASELINE, at, at);
    }

    public SessionRecord markActive(Instant at) {
        return new SessionRecord(phase, tool, sessionId, source, confidence,
                SessionStatus.ACTIVE, createdAt, at);
    }
}
