package com.agentcollab.core.triage;

import com.agentcollab.core.model.RetryAction;
import com.agentcollab.core.model.RetryDecision;
import com.agentcollab.core.model.Triage;
import org.springframework.stereotype.Component;

/**
 * Decides whether a failed attempt is retried in-process.
 * <p>
 * {@code signatureCount} is the cumulative count for the failure's signature and already
 * includes the failure being decided on. A retry is only granted while that count is below
 * the retry budget, so automatic retries for one signature never exceed the budget.
 */
@Component
public class RetryPolicy {

    /**
     * @param triage              classification of the failed attempt
     * @param signatureCount      cumulative failures with this signature, including this one
     * @param retryBudget         maximum failures per signature before giving up
     * @param compactionEscalated whether this stage already retried with aggressive compaction
     */
    public RetryDecision decide(Triage triage, int signatureCount, int retryBudget,
                                boolean compactionEscalated) {
        boolean withinBudget = signatureCount < retryBudget;
        return switch (triage.errorClass()) {
            case AUTH -> RetryDecision.stop("authentication failure requires manual intervention");
            case TRANSIENT -> withinBudget
                    ? RetryDecision.retry("transient failure " + signatureCount + "/" + retryBudget)
                    : RetryDecision.stop("retry budget exhausted for " + triage.signature()
                            + " (" + signatureCount + "/" + retryBudget + ")");
            case PROMPT_TOO_LARGE -> !compactionEscalated && withinBudget
                    ? new RetryDecision(RetryAction.RETRY_COMPACTED, "retrying once with aggressive compaction")
                    : RetryDecision.stop("request still too large after compaction");
            case TOOLING -> RetryDecision.stop("tooling failure; fix the tool installation or inputs");
            case CONTRACT_VIOLATION -> signatureCount >= 2
                    ? new RetryDecision(RetryAction.STOP_REROUTE,
                            "contract violated " + signatureCount + " times; re-route the stage manually")
                    : RetryDecision.stop("output contract violated");
            case SCOPE_VIOLATION -> RetryDecision.stop("output exceeded the allowed scope");
            case UNKNOWN -> signatureCount == 1 && withinBudget
                    ? RetryDecision.retry("unknown failure, first occurrence")
                    : RetryDecision.stop("unknown failure repeated");
        };
    }
}
