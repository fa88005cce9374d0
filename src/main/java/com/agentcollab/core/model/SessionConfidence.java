package com.agentcollab.core.model;

public enum SessionConfidence {
    HIGH,
    MEDIUM
}
