package com.agentcollab.core.engine;

import com.agentcollab.core.model.SessionMode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call settings for a stage execution.
 *
 * @param phase       session-continuity scope
 * @param sessionMode session mode for this call
 * @param attachments extra named prompt sections, in order
 */
public record StageContext(String phase, SessionMode sessionMode, Map<String, String> attachments) {

    public StageContext {
        attachments = attachments == null ? Map.of() : new LinkedHashMap<>(attachments);
    }

    public static StageContext of(String phase, SessionMode sessionMode) {
        return new StageContext(phase, sessionMode, Map.of());
    }

    public StageContext withSessionMode(SessionMode mode) {
        return new StageContext(phase, mode, attachments);
    }

    public StageContext withAttachment(String name, String content) {
        Map<String, String> updated = new LinkedHashMap<>(attachments);
        updated.put(name, content);
        return new StageContext(phase, sessionMode, updated);
    }
}
