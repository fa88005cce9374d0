package com.agentcollab.core.review;

import com.agentcollab.core.model.FixQueueItem;

import java.time.Instant;
import java.util.List;

/**
 * Contents of {@code review/review_fix_queue.json}.
 */
public record FixQueueDocument(String taskName, List<FixQueueItem> items, Instant updatedAt) {

    public FixQueueDocument {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
