package com.agentcollab.adapter;

import com.agentcollab.core.model.GateResult;

/**
 * Validates a stage artifact against the output contract of its role.
 */
public interface GateValidator {

    GateResult validate(String artifact, String role);
}
