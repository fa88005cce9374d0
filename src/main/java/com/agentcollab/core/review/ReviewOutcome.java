package com.agentcollab.core.review;

import com.agentcollab.core.model.FixQueueItem;
import com.agentcollab.core.model.SecurityGateResult;

import java.util.List;

/**
 * @param lenses   lenses launched, in order
 * @param join     join barrier result
 * @param merge    merged findings and merge log
 * @param queue    fix queue after execution
 * @param security security gate result, null when the security lens did not run to completion
 */
public record ReviewOutcome(
    List<String> lenses,
    JoinResult join,
    MergeResult merge,
    List<FixQueueItem> queue,
    SecurityGateResult security
) {

    public ReviewOutcome {
        lenses = List.copyOf(lenses);
        queue = queue == null ? List.of() : List.copyOf(queue);
    }

    public List<String> degradedLenses() {
        return join.degradedLenses();
    }

    public List<String> timedOutLenses() {
        return join.timedOutLenses();
    }
}
