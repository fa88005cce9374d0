package com.agentcollab.adapter;

import com.agentcollab.core.model.DeadlineMode;

import java.time.Duration;

/**
 * One call to an external tool.
 *
 * @param stageId         stage the call belongs to
 * @param tool            tool name
 * @param prompt          composed request payload
 * @param model           model name, nullable
 * @param reasoningEffort reasoning-effort hint, nullable
 * @param deadline        wall-clock deadline, nullable for no deadline
 * @param deadlineMode    enforce or wait for the tool to finish
 * @param resumeSessionId session to resume, null for a fresh session
 */
public record ToolRequest(
    String stageId,
    String tool,
    String prompt,
    String model,
    String reasoningEffort,
    Duration deadline,
    DeadlineMode deadlineMode,
    String resumeSessionId
) {}
