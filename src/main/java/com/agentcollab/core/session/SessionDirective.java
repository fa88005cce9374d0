package com.agentcollab.core.session;

import com.agentcollab.core.model.CapabilityProbe;
import com.agentcollab.core.model.SessionMode;
import com.agentcollab.core.model.SessionRecord;

/**
 * Pre-stage session decision, carried through the call to post-stage validation.
 *
 * @param phase           phase scope
 * @param tool            stage tool
 * @param stageId         stage being run
 * @param mode            session mode in effect
 * @param probe           capability probe for (phase, tool), null when sessions are off
 * @param baseline        baseline record at decision time, null when none exists
 * @param resumeSessionId id to resume, null for a fresh call
 * @param snapshot        state directory snapshot for diff extraction, null when unused
 * @param leased          whether the (phase, tool) lease was acquired for this stage
 */
public record SessionDirective(
    String phase,
    String tool,
    String stageId,
    SessionMode mode,
    CapabilityProbe probe,
    SessionRecord baseline,
    String resumeSessionId,
    StateDirSnapshot snapshot,
    boolean leased
) {

    public static SessionDirective fresh(String phase, String tool, String stageId, SessionMode mode) {
        return new SessionDirective(phase, tool, stageId, mode, null, null, null, null, false);
    }

    /** Whether post-stage tracking applies to this call. */
    public boolean tracked() {
        return mode == SessionMode.FORCED_WITHIN_PHASE && probe != null && probe.resumeSupported();
    }

    public boolean resuming() {
        return resumeSessionId != null;
    }
}
