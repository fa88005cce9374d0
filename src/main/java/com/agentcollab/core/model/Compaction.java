package com.agentcollab.core.model;

/**
 * Context-compaction level applied when composing a stage request.
 */
public enum Compaction {
    NORMAL,
    AGGRESSIVE
}
