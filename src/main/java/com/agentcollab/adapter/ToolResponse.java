package com.agentcollab.adapter;

import com.agentcollab.core.model.ToolExitStatus;

/**
 * Normalized result of a tool call.
 *
 * @param artifact    primary output
 * @param diagnostics diagnostic stream (stderr)
 * @param exitStatus  normalized exit status
 * @param exitCode    raw exit code
 * @param sessionId   session id reported directly by the adapter, nullable
 * @param eventLog    raw structured event stream for session extraction, nullable
 */
public record ToolResponse(
    String artifact,
    String diagnostics,
    ToolExitStatus exitStatus,
    int exitCode,
    String sessionId,
    String eventLog
) {

    public static ToolResponse success(String artifact) {
        return new ToolResponse(artifact, "", ToolExitStatus.SUCCESS, 0, null, null);
    }

    public static ToolResponse failure(ToolExitStatus status, int exitCode, String diagnostics) {
        return new ToolResponse("", diagnostics, status, exitCode, null, null);
    }

    public ToolResponse withSessionId(String id) {
        return new ToolResponse(artifact, diagnostics, exitStatus, exitCode, id, eventLog);
    }
}
