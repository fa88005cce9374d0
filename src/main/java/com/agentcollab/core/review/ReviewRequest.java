package com.agentcollab.core.review;

import com.agentcollab.core.model.SecurityMode;

/**
 * Inputs of one parallel review.
 *
 * @param taskName              task directory name, recorded in review artifacts
 * @param contextPack           base context pack shared by all lenses
 * @param implementationSummary summary of the implementation under review, may be empty
 * @param securitySensitive     whether the task is flagged security-sensitive
 * @param securityMode          security lens mode
 */
public record ReviewRequest(
    String taskName,
    String contextPack,
    String implementationSummary,
    boolean securitySensitive,
    SecurityMode securityMode
) {

    public ReviewRequest {
        contextPack = contextPack == null ? "" : contextPack;
        implementationSummary = implementationSummary == null ? "" : implementationSummary;
        securityMode = securityMode == null ? SecurityMode.AUTO : securityMode;
    }

    public boolean securityEnabled() {
        return SecurityTrigger.enabled(securityMode, securitySensitive, contextPack, implementationSummary);
    }
}
