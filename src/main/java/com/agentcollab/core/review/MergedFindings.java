package com.agentcollab.core.review;

import com.agentcollab.core.model.Finding;

import java.time.Instant;
import java.util.List;

/**
 * Contents of {@code review/review_merged_findings.json}.
 */
public record MergedFindings(
    String taskName,
    int lensCount,
    int findingCount,
    List<Finding> findings,
    Instant generatedAt
) {

    public MergedFindings {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }
}
