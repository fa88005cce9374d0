package com.agentcollab.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Result of validating a stage artifact against its output contract.
 *
 * @param outcome pass or the kind of violation
 * @param reasons violated-contract reasons, empty on pass
 */
public record GateResult(GateOutcome outcome, List<String> reasons) implements Serializable {

    public GateResult {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public static GateResult pass() {
        return new GateResult(GateOutcome.PASS, List.of());
    }

    public static GateResult notRun() {
        return new GateResult(GateOutcome.NOT_RUN, List.of());
    }

    public static GateResult contractViolation(List<String> reasons) {
        return new GateResult(GateOutcome.CONTRACT_VIOLATION, reasons);
    }

    public static GateResult scopeViolation(List<String> reasons) {
        return new GateResult(GateOutcome.SCOPE_VIOLATION, reasons);
    }

    public boolean passed() {
        return outcome == GateOutcome.PASS;
    }

    public boolean violated() {
        return outcome == GateOutcome.CONTRACT_VIOLATION || outcome == GateOutcome.SCOPE_VIOLATION;
    }
}
