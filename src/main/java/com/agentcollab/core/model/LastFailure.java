package com.agentcollab.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Structured record of the most recent stage failure, overwritten on each new failure.
 *
 * @param stage            failing stage
 * @param tool             tool of the failing stage
 * @param errorClass       failure class label; includes {@code session_mismatch},
 *                         {@code budget_exhausted} and {@code internal}, which sit outside the
 *                         retry taxonomy
 * @param signature        normalized signature, nullable
 * @param exitCode         raw exit code, -1 when the failure is not tied to a tool exit
 * @param decision         retry decision reason
 * @param suggestedActions operator actions
 * @param at               when the failure was recorded
 */
public record LastFailure(
    String stage,
    String tool,
    String errorClass,
    String signature,
    int exitCode,
    String decision,
    List<String> suggestedActions,
    Instant at
) implements Serializable {

    public LastFailure {
        suggestedActions = suggestedActions == null ? List.of() : List.copyOf(suggestedActions);
    }
}
