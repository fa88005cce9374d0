package com.agentcollab.core.session;

/**
 * Result of extracting the session id used by a call.
 *
 * @param sessionId     extracted id, null on failure
 * @param failureReason why extraction failed, null on success
 */
public record SessionExtraction(String sessionId, String failureReason) {

    public static SessionExtraction found(String sessionId) {
        return new SessionExtraction(sessionId, null);
    }

    public static SessionExtraction failed(String reason) {
        return new SessionExtraction(null, reason);
    }

    public boolean isFound() {
        return sessionId != null;
    }
}
