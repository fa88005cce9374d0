package com.agentcollab.core.model;

import java.util.Locale;

public enum SessionMode {
    /** Never resume; every stage runs fresh. */
    OFF,
    /** Resume the phase baseline for every stage of the same tool within a phase. */
    FORCED_WITHIN_PHASE;

    public static SessionMode fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return FORCED_WITHIN_PHASE;
        }
        return valueOf(label.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
