package com.agentcollab.core.review;

import com.agentcollab.core.model.FixQueueItem;
import com.agentcollab.core.model.FixStatus;
import com.agentcollab.core.model.SecurityGateResult;
import com.agentcollab.core.state.StateStore;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes {@code review/summary.md}, the operator-facing digest of a parallel review.
 */
@Component
public class ReviewSummaryWriter {

    static final String SUMMARY_DOCUMENT = "review/summary.md";

    private final StateStore stateStore;

    public ReviewSummaryWriter(StateStore stateStore) {
        this.stateStore = stateStore;
    }

    public String write(ReviewOutcome outcome) {
        String summary = render(outcome);
        stateStore.writeDocument(SUMMARY_DOCUMENT, summary);
        return summary;
    }

    String render(ReviewOutcome outcome) {
        var sb = new StringBuilder();
        sb.append("# Parallel Review Summary\n\n");
        sb.append("- lenses: ").append(String.join(", ", outcome.lenses())).append('\n');
        sb.append("- join: ").append(outcome.join().status().name().toLowerCase(Locale.ROOT))
                .append(" (").append(outcome.join().elapsed().toSeconds()).append("s)\n");
        if (!outcome.timedOutLenses().isEmpty()) {
            sb.append("- timed out: ").append(String.join(", ", outcome.timedOutLenses())).append('\n');
        }
        if (!outcome.degradedLenses().isEmpty()) {
            sb.append("- degraded: ").append(String.join(", ", outcome.degradedLenses())).append('\n');
        }

        MergeLog mergeLog = outcome.merge().log();
        sb.append("\n## Findings\n");
        sb.append("- merged: ").append(mergeLog.finalCount()).append('\n');
        sb.append("- duplicates removed: ").append(mergeLog.dedupRemoved()).append('\n');
        sb.append("- severity conflicts resolved: ").append(mergeLog.conflictResolved()).append('\n');
        sb.append("- evidence rejected: ").append(mergeLog.evidenceRejected()).append('\n');

        sb.append("\n## Fix Queue\n");
        if (outcome.queue().isEmpty()) {
            sb.append("- empty\n");
        } else {
            Map<FixStatus, Integer> byStatus = new TreeMap<>();
            for (FixQueueItem item : outcome.queue()) {
                byStatus.merge(item.status(), 1, Integer::sum);
            }
            byStatus.forEach((status, count) ->
                    sb.append("- ").append(status.name().toLowerCase(Locale.ROOT)).append(": ").append(count).append('\n'));
        }

        sb.append("\n## Security Gate\n");
        SecurityGateResult security = outcome.security();
        if (security == null) {
            sb.append("- not evaluated\n");
        } else {
            sb.append("- outcome: ").append(security.outcome()).append('\n');
            sb.append("- final severity: ").append(security.finalSeverity()).append('\n');
            sb.append("- rounds: ").append(security.roundsRun()).append('\n');
            if (security.stopAction() != null) {
                sb.append("- action: ").append(security.stopAction()).append('\n');
            }
            security.criticalFindings().forEach(f -> sb.append("  - critical: ").append(f).append('\n'));
            security.highFindingsRemaining().forEach(f -> sb.append("  - high: ").append(f).append('\n'));
        }
        return sb.toString();
    }
}
