package com.agentcollab.core.review;

public record MergeResult(MergedFindings merged, MergeLog log) {}
