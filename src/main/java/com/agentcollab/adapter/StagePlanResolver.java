package com.agentcollab.adapter;

import com.agentcollab.core.model.StagePlan;

/**
 * Resolves a pipeline id into a fully-specified stage plan. Precedence between profiles,
 * manifests and overrides is the resolver's concern, never the orchestrator's.
 */
public interface StagePlanResolver {

    StagePlan resolve(String pipelineId, String profile);
}
