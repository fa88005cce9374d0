package com.agentcollab.core.review;

import com.agentcollab.core.engine.StageContext;
import com.agentcollab.core.model.FixQueueItem;

/**
 * Applies fixes with the configured fix tool.
 */
public interface FixApplier {

    /**
     * Whether a fix tool is configured and installed.
     */
    boolean available(StageContext context);

    /**
     * Applies one queue item.
     *
     * @return the item with status {@code APPLIED} or {@code FAILED} and a note
     */
    FixQueueItem apply(FixQueueItem item, StageContext context);

    /**
     * Runs one security fix round against the findings document.
     *
     * @return true when the fix stage succeeded
     */
    boolean applySecurityRound(int round, String findingsJson, StageContext context);
}
