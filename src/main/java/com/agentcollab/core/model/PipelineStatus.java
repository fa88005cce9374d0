package com.agentcollab.core.model;

public enum PipelineStatus {
    COMPLETED,
    FAILED
}
