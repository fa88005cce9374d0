package com.agentcollab.core.model;

public enum FixStatus {
    PENDING,
    APPLIED,
    FAILED,
    SKIPPED
}
