package com.agentcollab.core.review;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Contents of {@code review/review_merge_log.json}.
 *
 * @param lenses            lenses whose output was merged
 * @param rawFindingCounts  findings parsed per lens before dedup
 * @param dedupRemoved      findings dropped as duplicates
 * @param conflictResolved  duplicates whose severity outranked the kept record and replaced it
 * @param evidenceRejected  findings citing only a bare link, with no CVE, RFC or evidence id
 * @param finalCount        findings after dedup
 * @param generatedAt       when the merge ran
 */
public record MergeLog(
    List<String> lenses,
    Map<String, Integer> rawFindingCounts,
    int dedupRemoved,
    int conflictResolved,
    int evidenceRejected,
    int finalCount,
    Instant generatedAt
) {}
