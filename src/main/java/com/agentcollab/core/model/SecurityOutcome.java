package com.agentcollab.core.model;

/**
 * Terminal state of the security escalation loop.
 */
public enum SecurityOutcome {
    CLEAN,
    WARNING_HIGH_REMAINING,
    CRITICAL_STOP
}
