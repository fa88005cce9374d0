package com.agentcollab.core.model;

import java.io.Serializable;

/**
 * Outcome of executing one stage, including all retries.
 *
 * @param stageId  the stage
 * @param tool     the stage tool
 * @param role     the stage role
 * @param status   final status
 * @param artifact final artifact text, null when the stage failed or was skipped
 * @param triage   classification of the final failed attempt, null on success
 * @param attempts adapter attempts made during this execution
 */
public record StageResult(
    String stageId,
    String tool,
    String role,
    StageStatus status,
    String artifact,
    Triage triage,
    int attempts
) implements Serializable {

    public static StageResult skipped(StageSpec stage) {
        return new StageResult(stage.stageId(), stage.tool(), stage.role(),
                StageStatus.SKIPPED_DONE, null, null, 0);
    }

    public boolean succeeded() {
        return status.isSuccess();
    }
}
