package com.agentcollab.core.review;

import com.agentcollab.core.model.Finding;
import com.agentcollab.core.model.FixQueueItem;
import com.agentcollab.core.model.FixStatus;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the fix queue from merged findings: most severe first. The sort is stable, so findings
 * of equal severity keep their merged (discovery) order.
 */
public final class FixQueueBuilder {

    private FixQueueBuilder() {}

    public static List<FixQueueItem> build(List<Finding> findings) {
        List<Finding> ordered = new ArrayList<>(findings);
        ordered.sort(Comparator.comparingInt((Finding f) -> f.severity().priority()));

        List<FixQueueItem> queue = new ArrayList<>();
        int index = 1;
        for (Finding finding : ordered) {
            queue.add(new FixQueueItem(
                    String.format("Q%03d", index++),
                    finding.findingId(),
                    finding.targetFile(),
                    finding.targetLocation(),
                    action(finding),
                    finding.severity(),
                    finding.severity().priority(),
                    FixStatus.PENDING,
                    null));
        }
        return queue;
    }

    static String action(Finding finding) {
        if (!finding.proposedImprovement().isBlank()) {
            return finding.proposedImprovement();
        }
        if (finding.issue() != null && !finding.issue().isBlank()) {
            return finding.issue();
        }
        return "Address finding";
    }
}
