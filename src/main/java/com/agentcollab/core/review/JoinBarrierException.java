package com.agentcollab.core.review;

/**
 * Thrown when the review join cannot be performed: a worker handle is missing or invalid, or
 * the joining thread was interrupted.
 */
public class JoinBarrierException extends RuntimeException {

    public JoinBarrierException(String message) {
        super(message);
    }

    public JoinBarrierException(String message, Throwable cause) {
        super(message, cause);
    }
}
