package com.agentcollab.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for stage dispatch, sessions and parallel review.
 */
@Service
public class CollabMetrics {

    private final MeterRegistry registry;

    public CollabMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStageAttempt(String tool, String outcome, Duration elapsed) {
        Timer.builder("agentcollab.stage.duration")
                .tag("tool", tool)
                .tag("outcome", outcome)
                .register(registry)
                .record(elapsed);
    }

    public void incrementPaidCalls(String tool) {
        Counter.builder("agentcollab.paid_calls.total")
                .tag("tool", tool)
                .register(registry)
                .increment();
    }

    public void recordRetry(String errorClass) {
        Counter.builder("agentcollab.retries.total")
                .tag("class", errorClass)
                .register(registry)
                .increment();
    }

    public void recordStageFailure(String errorClass) {
        Counter.builder("agentcollab.stage.failures")
                .tag("class", errorClass)
                .register(registry)
                .increment();
    }

    public void recordSessionMismatch(String tool) {
        Counter.builder("agentcollab.session.mismatches")
                .tag("tool", tool)
                .register(registry)
                .increment();
    }

    // --- Parallel review ---

    /**
     * @param outcome completed, degraded or timed_out
     */
    public void recordLensOutcome(String lens, String outcome) {
        Counter.builder("agentcollab.review.lens")
                .tag("lens", lens)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordJoinBarrier(Duration elapsed, boolean timedOut) {
        Timer.builder("agentcollab.review.join")
                .tag("timed_out", String.valueOf(timedOut))
                .register(registry)
                .record(elapsed);
    }

    public void recordMergedFindings(int count) {
        DistributionSummary.builder("agentcollab.review.findings")
                .description("Findings remaining after merge and dedup")
                .register(registry)
                .record(count);
    }

    public void recordFixOutcome(String status) {
        Counter.builder("agentcollab.review.fixes")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordSecurityOutcome(String outcome, int rounds) {
        Counter.builder("agentcollab.security.outcomes")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        DistributionSummary.builder("agentcollab.security.rounds")
                .register(registry)
                .record(rounds);
    }
}
