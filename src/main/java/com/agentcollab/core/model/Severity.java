package com.agentcollab.core.model;

import java.util.Locale;

/**
 * Finding severity. Rank orders severities (higher is worse); priority is the fix-queue order
 * (1 is processed first).
 */
public enum Severity {
    CRITICAL(5),
    MAJOR(4),
    MEDIUM(3),
    MINOR(2),
    LOW(1);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public int priority() {
        return 6 - rank;
    }

    public boolean isAtLeast(Severity other) {
        return rank >= other.rank;
    }

    public static Severity max(Severity a, Severity b) {
        return a.rank >= b.rank ? a : b;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
