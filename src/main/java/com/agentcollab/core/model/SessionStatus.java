package com.agentcollab.core.model;

public enum SessionStatus {
    /** Recorded by the first stage of the phase. */
    BASELINE,
    /** Resumed and validated at least once. */
    ACTIVE
}
