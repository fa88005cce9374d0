package com.agentcollab.core.model;

/**
 * How a stage deadline is applied to the tool call.
 */
public enum DeadlineMode {
    /** Kill the tool when the deadline passes and report a timeout. */
    ENFORCE,
    /** Let the tool run until it exits on its own; the deadline is advisory. */
    WAIT_DONE
}
