package com.agentcollab.core.model;

import java.util.Locale;

/**
 * Whether the security lens joins a parallel review.
 */
public enum SecurityMode {
    OFF,
    ALWAYS,
    /** Enabled when the task is flagged security-sensitive or its context mentions security keywords. */
    AUTO;

    public static SecurityMode fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return AUTO;
        }
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
