package com.agentcollab.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Ordered, immutable sequence of stages resolved for a single pipeline run.
 *
 * @param pipelineId the pipeline this plan was resolved from
 * @param phase      session-continuity scope shared by all stages in the plan
 * @param profile    the profile or override set used during resolution, nullable
 * @param stages     stages in execution order
 */
public record StagePlan(
    String pipelineId,
    String phase,
    String profile,
    List<StageSpec> stages
) implements Serializable {

    public StagePlan {
        stages = stages == null ? List.of() : List.copyOf(stages);
        if (phase == null || phase.isBlank()) {
            phase = pipelineId;
        }
    }

    public StageSpec stage(String stageId) {
        return stages.stream()
                .filter(s -> s.stageId().equals(stageId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Stage " + stageId + " is not part of pipeline " + pipelineId));
    }
}
