package com.agentcollab.adapter;

import com.agentcollab.config.CollabProperties;
import com.agentcollab.core.model.StagePlan;
import com.agentcollab.core.model.StageSpec;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Resolves plans from {@code agentcollab.pipelines.<id>}; stage deadlines fall back to the
 * dispatch defaults. The profile is recorded on the plan but selects nothing.
 */
@Component
public class PropertiesStagePlanResolver implements StagePlanResolver {

    private final CollabProperties properties;

    public PropertiesStagePlanResolver(CollabProperties properties) {
        this.properties = properties;
    }

    @Override
    public StagePlan resolve(String pipelineId, String profile) {
        CollabProperties.Pipeline pipeline = properties.getPipelines().get(pipelineId);
        if (pipeline == null) {
            throw new IllegalArgumentException("Unknown pipeline: " + pipelineId
                    + " (configured: " + properties.getPipelines().keySet() + ")");
        }
        List<StageSpec> stages = pipeline.getStages().stream()
                .map(this::toStage)
                .toList();
        return new StagePlan(pipelineId, pipeline.getPhase(), profile, stages);
    }

    private StageSpec toStage(CollabProperties.StageEntry entry) {
        Duration deadline = entry.getDeadlineSeconds() != null
                ? Duration.ofSeconds(entry.getDeadlineSeconds())
                : properties.getDefaultDeadline();
        return new StageSpec(
                null,
                entry.getTool(),
                entry.getRole(),
                entry.getModel(),
                entry.getReasoningEffort(),
                deadline,
                entry.getDeadlineMode() != null
                        ? CollabProperties.parseDeadlineMode(entry.getDeadlineMode())
                        : properties.getDefaultDeadlineMode());
    }
}
