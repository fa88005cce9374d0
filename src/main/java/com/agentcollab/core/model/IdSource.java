package com.agentcollab.core.model;

import java.util.Locale;

/**
 * Mechanism used to learn which session a tool call actually used.
 */
public enum IdSource {
    /** A structured protocol event in the tool's event stream. */
    STRUCTURED_EVENT(SessionConfidence.HIGH),
    /** A before/after diff of the tool's local state directory. */
    STATE_DIR_DIFF(SessionConfidence.MEDIUM),
    NONE(SessionConfidence.MEDIUM);

    private final SessionConfidence confidence;

    IdSource(SessionConfidence confidence) {
        this.confidence = confidence;
    }

    public SessionConfidence confidence() {
        return confidence;
    }

    public static IdSource fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return NONE;
        }
        return valueOf(label.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
