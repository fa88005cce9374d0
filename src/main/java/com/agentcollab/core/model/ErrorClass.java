package com.agentcollab.core.model;

import java.util.List;
import java.util.Locale;

/**
 * Failure taxonomy used for retry decisions, with the actions suggested to an operator.
 */
public enum ErrorClass {
    TRANSIENT(List.of(
            "Retry after a short backoff",
            "Check network connectivity and tool service status")),
    PROMPT_TOO_LARGE(List.of(
            "Re-run with aggressive context compaction",
            "Trim inputs or split the stage into smaller requests")),
    AUTH(List.of(
            "Re-authenticate the tool CLI",
            "Check API key or token expiry",
            "No auto-retry: manual intervention required")),
    TOOLING(List.of(
            "Install or fix the tool binary and ensure it is on PATH",
            "Verify the stage inputs exist")),
    SCOPE_VIOLATION(List.of(
            "Review the output for changes outside the allowed scope",
            "Tighten the stage constraints and re-run manually")),
    CONTRACT_VIOLATION(List.of(
            "Inspect the gate reasons and the stage output",
            "Re-run the stage or re-route it to another tool")),
    UNKNOWN(List.of(
            "Inspect the stage stderr and meta record",
            "Re-run the stage once the cause is understood"));

    private final List<String> suggestedActions;

    ErrorClass(List<String> suggestedActions) {
        this.suggestedActions = suggestedActions;
    }

    public List<String> suggestedActions() {
        return suggestedActions;
    }

    /** Lower-case name used in signatures, summaries and persisted records. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
