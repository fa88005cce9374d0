package com.agentcollab.core.model;

import java.io.Serializable;

/**
 * @param action what the executor does next
 * @param reason human-readable explanation, shown in logs and the last-failure record
 */
public record RetryDecision(RetryAction action, String reason) implements Serializable {

    public static RetryDecision retry(String reason) {
        return new RetryDecision(RetryAction.RETRY, reason);
    }

    public static RetryDecision stop(String reason) {
        return new RetryDecision(RetryAction.STOP, reason);
    }

    public boolean shouldRetry() {
        return action.retries();
    }
}
