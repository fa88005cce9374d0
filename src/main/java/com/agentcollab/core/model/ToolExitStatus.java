package com.agentcollab.core.model;

/**
 * Exit status of a tool call, normalized at the adapter boundary.
 */
public enum ToolExitStatus {
    SUCCESS,
    MISSING_BINARY,
    MISSING_INPUT,
    GENERAL_FAILURE,
    TIMEOUT,
    INPUT_TOO_LARGE;

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
