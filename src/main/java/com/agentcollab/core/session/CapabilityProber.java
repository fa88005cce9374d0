package com.agentcollab.core.session;

import com.agentcollab.core.model.CapabilityProbe;

/**
 * Detects whether a tool can resume sessions and how its session ids can be observed.
 */
public interface CapabilityProber {

    CapabilityProbe probe(String tool);
}
