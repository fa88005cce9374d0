package com.agentcollab.core.model;

public enum RetryAction {
    RETRY,
    /** Retry with escalated context compaction. */
    RETRY_COMPACTED,
    STOP,
    /** Stop and report the stage for manual re-routing to another tool. */
    STOP_REROUTE;

    public boolean retries() {
        return this == RETRY || this == RETRY_COMPACTED;
    }
}
