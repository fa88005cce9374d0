package com.agentcollab.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Meta record of the latest attempt of a stage. Each attempt overwrites the previous one.
 *
 * @param stageId       the stage attempted
 * @param tool          tool that ran the attempt
 * @param exitCode      raw exit code reported by the adapter
 * @param exitStatus    normalized exit status
 * @param startedAt     wall-clock start of the adapter call
 * @param endedAt       wall-clock end of the adapter call
 * @param durationSec   elapsed seconds
 * @param requestSha256 content hash of the composed request
 */
public record StageRun(
    String stageId,
    String tool,
    int exitCode,
    ToolExitStatus exitStatus,
    Instant startedAt,
    Instant endedAt,
    long durationSec,
    String requestSha256
) implements Serializable {}
