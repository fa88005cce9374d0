package com.agentcollab.core.review;

import com.agentcollab.core.engine.BudgetExhaustedException;
import com.agentcollab.core.engine.StageContext;
import com.agentcollab.core.engine.StageInterruptedException;
import com.agentcollab.core.metrics.CollabMetrics;
import com.agentcollab.core.model.FixQueueItem;
import com.agentcollab.core.model.FixStatus;
import com.agentcollab.core.session.ConcurrentResumeException;
import com.agentcollab.core.session.SessionMismatchException;
import com.agentcollab.core.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Applies queue items strictly one at a time in queue order. Each item's outcome is
 * independent of the others, and the queue file is rewritten after every item so an
 * interrupted run shows exactly how far it got.
 * <p>
 * Session continuity failures and interruptions are not item outcomes: they stop the queue
 * and propagate so no further stage runs.
 */
@Component
public class FixQueueExecutor {

    private static final Logger log = LoggerFactory.getLogger(FixQueueExecutor.class);

    static final String QUEUE_DOCUMENT = "review/review_fix_queue.json";

    private final FixApplier fixApplier;
    private final StateStore stateStore;
    private final CollabMetrics metrics;

    public FixQueueExecutor(FixApplier fixApplier, StateStore stateStore, CollabMetrics metrics) {
        this.fixApplier = fixApplier;
        this.stateStore = stateStore;
        this.metrics = metrics;
    }

    public List<FixQueueItem> execute(String taskName, List<FixQueueItem> queue, StageContext context) {
        List<FixQueueItem> items = new ArrayList<>(queue);
        persist(taskName, items);
        if (items.isEmpty()) {
            return items;
        }

        boolean capable = fixApplier.available(context);
        if (!capable) {
            log.warn("No fix capability; skipping {} queue items", items.size());
        }
        for (int i = 0; i < items.size(); i++) {
            FixQueueItem item = items.get(i);
            FixQueueItem outcome;
            if (!capable) {
                outcome = item.withStatus(FixStatus.SKIPPED, "no fix capability");
            } else {
                outcome = applyOne(item, context);
            }
            items.set(i, outcome);
            metrics.recordFixOutcome(outcome.status().name().toLowerCase(Locale.ROOT));
            persist(taskName, items);
            log.info("Fix {} ({} {}): {}", outcome.queueId(), outcome.severity().label(),
                    outcome.findingId(), outcome.status());
        }
        return items;
    }

    private FixQueueItem applyOne(FixQueueItem item, StageContext context) {
        try {
            return fixApplier.apply(item, context);
        } catch (SessionMismatchException | ConcurrentResumeException | StageInterruptedException e) {
            throw e;
        } catch (BudgetExhaustedException e) {
            return item.withStatus(FixStatus.FAILED, "budget_exhausted");
        } catch (RuntimeException e) {
            log.warn("Fix {} aborted: {}", item.queueId(), e.getMessage());
            return item.withStatus(FixStatus.FAILED, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void persist(String taskName, List<FixQueueItem> items) {
        stateStore.writeJson(QUEUE_DOCUMENT, new FixQueueDocument(taskName, items, Instant.now()));
    }
}
