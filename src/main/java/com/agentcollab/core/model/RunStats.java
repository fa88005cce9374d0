package com.agentcollab.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-task budget and failure counters. Instances are immutable; every mutation returns a copy.
 *
 * @param paidCallsUsed   adapter attempts made so far
 * @param stagesCompleted stages that reached their done-marker, in completion order
 * @param signatures      failure signatures keyed by signature
 */
public record RunStats(
    int paidCallsUsed,
    List<String> stagesCompleted,
    Map<String, ErrorSignature> signatures
) implements Serializable {

    public RunStats {
        stagesCompleted = stagesCompleted == null ? List.of() : List.copyOf(stagesCompleted);
        signatures = signatures == null ? Map.of() : Map.copyOf(signatures);
    }

    public static RunStats empty() {
        return new RunStats(0, List.of(), Map.of());
    }

    public RunStats withPaidCall() {
        return new RunStats(paidCallsUsed + 1, stagesCompleted, signatures);
    }

    public RunStats withStageCompleted(String stageId) {
        if (stagesCompleted.contains(stageId)) {
            return this;
        }
        List<String> completed = new ArrayList<>(stagesCompleted);
        completed.add(stageId);
        return new RunStats(paidCallsUsed, completed, signatures);
    }

    public RunStats withSignature(ErrorClass errorClass, String signature, Instant at) {
        Map<String, ErrorSignature> updated = new LinkedHashMap<>(signatures);
        ErrorSignature existing = updated.get(signature);
        updated.put(signature, existing == null
                ? ErrorSignature.first(errorClass, signature, at)
                : existing.recordOccurrence(at));
        return new RunStats(paidCallsUsed, stagesCompleted, updated);
    }

    public int signatureCount(String signature) {
        ErrorSignature sig = signatures.get(signature);
        return sig == null ? 0 : sig.count();
    }
}
