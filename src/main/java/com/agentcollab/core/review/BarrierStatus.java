package com.agentcollab.core.review;

public enum BarrierStatus {
    COMPLETED,
    /** At least one lens missed the shared deadline and was cancelled. */
    TIMED_OUT
}
