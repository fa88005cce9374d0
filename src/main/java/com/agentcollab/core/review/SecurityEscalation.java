package com.agentcollab.core.review;

import com.agentcollab.core.engine.StageContext;
import com.agentcollab.core.events.CollabEvent;
import com.agentcollab.core.events.EventBus;
import com.agentcollab.core.metrics.CollabMetrics;
import com.agentcollab.core.model.Finding;
import com.agentcollab.core.model.SecurityGateResult;
import com.agentcollab.core.model.SecurityMode;
import com.agentcollab.core.model.SecurityOutcome;
import com.agentcollab.core.model.Severity;
import com.agentcollab.core.state.FileStateStore;
import com.agentcollab.core.state.StateStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Security gate over the security lens's findings.
 * <p>
 * Critical stops immediately and asks for confirmation. High runs up to {@code maxRounds} of
 * fix, verify and a security-only re-review; the loop ends clean as soon as the re-review drops
 * below high, stops if it turns critical, and otherwise ends with high findings remaining.
 * Anything below high is clean without a round. A failed fix or verify stage does not end the
 * loop; the re-review decides.
 */
@Component
public class SecurityEscalation {

    private static final Logger log = LoggerFactory.getLogger(SecurityEscalation.class);

    static final String GATE_DOCUMENT = "review/security_gate_result.json";
    static final String NONE = "none";

    private final FixApplier fixApplier;
    private final RegressionVerifier verifier;
    private final LensRunner lensRunner;
    private final StateStore stateStore;
    private final EventBus eventBus;
    private final CollabMetrics metrics;
    private final ObjectMapper objectMapper = FileStateStore.createObjectMapper();

    public SecurityEscalation(FixApplier fixApplier, RegressionVerifier verifier, LensRunner lensRunner,
                              StateStore stateStore, EventBus eventBus, CollabMetrics metrics) {
        this.fixApplier = fixApplier;
        this.verifier = verifier;
        this.lensRunner = lensRunner;
        this.stateStore = stateStore;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * @param securityFindings merged findings reported by the security lens
     */
    public SecurityGateResult evaluate(SecurityMode mode, List<Finding> securityFindings, int maxRounds,
                                       StageContext context) {
        Optional<Severity> observed = maxSeverity(securityFindings);
        SecurityGateResult result;
        if (observed.isPresent() && observed.get() == Severity.CRITICAL) {
            log.error("Critical security findings; stopping for confirmation");
            result = critical(mode, securityFindings, 0);
        } else if (observed.isPresent() && observed.get() == Severity.MAJOR) {
            result = escalate(mode, securityFindings, maxRounds, context);
        } else {
            result = new SecurityGateResult(mode.label(), observed.map(SecurityEscalation::label).orElse(NONE),
                    null, 0, List.of(), List.of(), SecurityOutcome.CLEAN, Instant.now());
        }
        stateStore.writeJson(GATE_DOCUMENT, result);
        metrics.recordSecurityOutcome(result.outcome().name().toLowerCase(Locale.ROOT), result.roundsRun());
        log.info("Security gate: {} (final severity {}, {} rounds)", result.outcome(),
                result.finalSeverity(), result.roundsRun());
        return result;
    }

    private SecurityGateResult escalate(SecurityMode mode, List<Finding> initial, int maxRounds,
                                        StageContext context) {
        List<Finding> current = initial;
        for (int round = 1; round <= maxRounds; round++) {
            log.warn("High security findings remain; starting security round {}/{}", round, maxRounds);
            eventBus.publish(CollabEvent.of("security.round", context.phase(), null,
                    Map.of("round", round, "maxRounds", maxRounds, "open", current.size())));

            String findingsJson = toJson(current);
            stateStore.writeDocument("review/security_fix_rounds/round-" + round + ".json", findingsJson);
            if (!fixApplier.applySecurityRound(round, findingsJson, context)) {
                log.warn("Security fix stage failed in round {}", round);
            }
            if (!verifier.verify(round, context)) {
                log.warn("Regression verification failed in round {}", round);
            }

            LensReport rereview = lensRunner.run(LensPrompts.SECURITY, round, context);
            if (rereview.isDegraded()) {
                log.warn("Security re-review degraded in round {} (exit={}); findings unchanged",
                        round, rereview.exitCode());
                continue;
            }
            stateStore.writeDocument("review/findings/security_r" + round + ".md", rereview.output());
            current = FindingParser.parse(LensPrompts.SECURITY, rereview.output());
            Optional<Severity> severity = maxSeverity(current);
            if (severity.isPresent() && severity.get() == Severity.CRITICAL) {
                log.error("Security re-review found critical issues in round {}", round);
                return critical(mode, current, round);
            }
            if (severity.isEmpty() || severity.get().rank() < Severity.MAJOR.rank()) {
                return new SecurityGateResult(mode.label(), NONE, null, round, List.of(), List.of(),
                        SecurityOutcome.CLEAN, Instant.now());
            }
        }
        List<String> remaining = current.stream()
                .filter(f -> f.severity() == Severity.MAJOR)
                .map(Finding::issue)
                .toList();
        log.warn("Security rounds exhausted with {} high findings remaining", remaining.size());
        return new SecurityGateResult(mode.label(), label(Severity.MAJOR), null, maxRounds, List.of(), remaining,
                SecurityOutcome.WARNING_HIGH_REMAINING, Instant.now());
    }

    private static SecurityGateResult critical(SecurityMode mode, List<Finding> findings, int rounds) {
        List<String> critical = findings.stream()
                .filter(f -> f.severity() == Severity.CRITICAL)
                .map(Finding::issue)
                .toList();
        return new SecurityGateResult(mode.label(), label(Severity.CRITICAL), SecurityGateResult.STOP_AND_CONFIRM,
                rounds, critical, List.of(), SecurityOutcome.CRITICAL_STOP, Instant.now());
    }

    static Optional<Severity> maxSeverity(List<Finding> findings) {
        return findings.stream().map(Finding::severity).reduce(Severity::max);
    }

    /**
     * Gate vocabulary: none, low, medium, high, critical.
     */
    static String label(Severity severity) {
        return switch (severity) {
            case CRITICAL -> "critical";
            case MAJOR -> "high";
            case MEDIUM -> "medium";
            case MINOR, LOW -> "low";
        };
    }

    private String toJson(List<Finding> findings) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(findings);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize security findings", e);
        }
    }
}
