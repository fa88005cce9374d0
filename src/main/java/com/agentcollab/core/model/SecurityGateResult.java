package com.agentcollab.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * @param mode                  security mode the review ran under
 * @param finalSeverity         severity after the loop: none, low, medium, high or critical
 * @param stopAction            {@code STOP_AND_CONFIRM} on critical, otherwise null
 * @param roundsRun             fix/verify/re-review rounds executed
 * @param criticalFindings      issues reported at critical severity
 * @param highFindingsRemaining high-severity issues still open when the loop ended
 * @param outcome               terminal state
 * @param timestamp             when the gate finished
 */
public record SecurityGateResult(
    String mode,
    String finalSeverity,
    String stopAction,
    int roundsRun,
    List<String> criticalFindings,
    List<String> highFindingsRemaining,
    SecurityOutcome outcome,
    Instant timestamp
) implements Serializable {

    public static final String STOP_AND_CONFIRM = "STOP_AND_CONFIRM";

    public SecurityGateResult {
        criticalFindings = criticalFindings == null ? List.of() : List.copyOf(criticalFindings);
        highFindingsRemaining = highFindingsRemaining == null ? List.of() : List.copyOf(highFindingsRemaining);
    }
}
