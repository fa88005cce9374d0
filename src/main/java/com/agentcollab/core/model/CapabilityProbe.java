package com.agentcollab.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Cached result of probing a tool for session-resume support.
 *
 * @param tool            probed tool
 * @param resumeSupported whether the tool can resume a prior session
 * @param idSource        how the used session id is extracted after a call
 * @param binaryFound     whether the tool binary was found on PATH
 * @param binaryPath      resolved binary path, nullable
 * @param notes           free-text probe notes
 * @param probedAt        when the probe ran
 */
public record CapabilityProbe(
    String tool,
    boolean resumeSupported,
    IdSource idSource,
    boolean binaryFound,
    String binaryPath,
    String notes,
    Instant probedAt
) implements Serializable {}
