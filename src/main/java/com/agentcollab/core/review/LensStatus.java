package com.agentcollab.core.review;

public enum LensStatus {
    COMPLETED,
    /** The lens failed without timing out; its findings are a placeholder. */
    DEGRADED
}
