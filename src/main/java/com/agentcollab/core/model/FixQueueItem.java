package com.agentcollab.core.model;

import java.io.Serializable;

/**
 * One actionable fix derived from a merged finding.
 *
 * @param queueId        sequential queue id ({@code Q001}, ...)
 * @param findingId      originating finding
 * @param targetFile     file to change, empty when unknown
 * @param targetLocation location within the file, empty when unknown
 * @param action         what to do
 * @param severity       severity of the originating finding
 * @param priority       processing priority, 1 first
 * @param status         application status
 * @param note           outcome detail, nullable
 */
public record FixQueueItem(
    String queueId,
    String findingId,
    String targetFile,
    String targetLocation,
    String action,
    Severity severity,
    int priority,
    FixStatus status,
    String note
) implements Serializable {

    public FixQueueItem withStatus(FixStatus newStatus, String newNote) {
        return new FixQueueItem(queueId, findingId, targetFile, targetLocation, action,
                severity, priority, newStatus, newNote);
    }
}
