package com.agentcollab.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * @param pipelineId  the pipeline that ran
 * @param status      completed when every stage succeeded
 * @param stages      results of the stages attempted, in plan order
 * @param failedStage the stage that stopped the pipeline, null on success
 * @param lastFailure the failure record written for the failed stage, null on success
 */
public record PipelineResult(
    String pipelineId,
    PipelineStatus status,
    List<StageResult> stages,
    String failedStage,
    LastFailure lastFailure
) implements Serializable {

    public PipelineResult {
        stages = stages == null ? List.of() : List.copyOf(stages);
    }
}
