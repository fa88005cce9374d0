package com.agentcollab.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Classification of a failed stage attempt.
 *
 * @param errorClass       failure class
 * @param signature        normalized signature, prefixed with the class label
 * @param exitCode         raw exit code of the attempt
 * @param gateOutcome      gate result that contributed to the classification
 * @param suggestedActions operator actions for this class
 */
public record Triage(
    ErrorClass errorClass,
    String signature,
    int exitCode,
    GateOutcome gateOutcome,
    List<String> suggestedActions
) implements Serializable {

    public Triage {
        suggestedActions = suggestedActions == null ? List.of() : List.copyOf(suggestedActions);
    }
}
