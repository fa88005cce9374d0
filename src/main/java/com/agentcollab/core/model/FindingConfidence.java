package com.agentcollab.core.model;

public enum FindingConfidence {
    HIGH,
    MEDIUM,
    LOW
}
