package com.agentcollab.core.model;

public enum GateOutcome {
    PASS,
    CONTRACT_VIOLATION,
    SCOPE_VIOLATION,
    NOT_RUN
}
