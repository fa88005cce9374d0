package com.agentcollab.core.model;

import java.io.Serializable;
import java.time.Duration;

/**
 * One resolved unit of a pipeline: a tool playing a role.
 *
 * @param stageId         unique stage name, conventionally {@code <tool>_<role>}
 * @param tool            the external tool that executes the stage
 * @param role            the role the tool plays (brief, plan, implement, review, ...)
 * @param model           model name forwarded to the tool, nullable
 * @param reasoningEffort optional reasoning-effort hint, nullable
 * @param deadline        wall-clock deadline for a single attempt
 * @param deadlineMode    whether the deadline is enforced or advisory
 */
public record StageSpec(
    String stageId,
    String tool,
    String role,
    String model,
    String reasoningEffort,
    Duration deadline,
    DeadlineMode deadlineMode
) implements Serializable {

    public StageSpec {
        if (tool == null || tool.isBlank()) {
            throw new IllegalArgumentException("stage tool must not be blank");
        }
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("stage role must not be blank");
        }
        if (stageId == null || stageId.isBlank()) {
            stageId = stageName(tool, role);
        }
        if (deadlineMode == null) {
            deadlineMode = DeadlineMode.ENFORCE;
        }
    }

    public static StageSpec of(String tool, String role, Duration deadline) {
        return new StageSpec(null, tool, role, null, null, deadline, DeadlineMode.ENFORCE);
    }

    public static String stageName(String tool, String role) {
        return tool + "_" + role;
    }
}
