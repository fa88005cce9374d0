package com.agentcollab.dispatch.cli;

import com.agentcollab.config.CollabProperties;
import com.agentcollab.core.engine.ContextPropagator;
import com.agentcollab.core.engine.StageContext;
import com.agentcollab.core.model.SecurityMode;
import com.agentcollab.core.model.SecurityOutcome;
import com.agentcollab.core.model.SessionMode;
import com.agentcollab.core.review.JoinBarrierException;
import com.agentcollab.core.review.ParallelReviewCoordinator;
import com.agentcollab.core.review.ReviewOutcome;
import com.agentcollab.core.review.ReviewRequest;
import com.agentcollab.core.review.ReviewSummaryWriter;
import com.agentcollab.core.state.StateStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: agent-collab review
 * <p>
 * Runs a parallel review outside any pipeline: lenses, merge, fix queue and security gate.
 */
@Command(name = "review", mixinStandardHelpOptions = true, description = "Run a parallel multi-lens review")
@Component
public class ReviewCommand implements Callable<Integer> {

    @Option(names = {"--security"}, description = "Security lens mode: off, always, auto")
    private String securityMode;

    @Option(names = {"--security-sensitive"}, description = "Flag the task as security-sensitive")
    private boolean securitySensitive;

    @Option(names = {"--phase"}, description = "Phase recorded on review stages (default: ${DEFAULT-VALUE})",
            defaultValue = "review")
    private String phase;

    private final ParallelReviewCoordinator coordinator;
    private final ReviewSummaryWriter summaryWriter;
    private final StateStore stateStore;
    private final CollabProperties properties;

    public ReviewCommand(ParallelReviewCoordinator coordinator, ReviewSummaryWriter summaryWriter,
                         StateStore stateStore, CollabProperties properties) {
        this.coordinator = coordinator;
        this.summaryWriter = summaryWriter;
        this.stateStore = stateStore;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        SecurityMode mode;
        try {
            mode = securityMode != null ? SecurityMode.fromLabel(securityMode) : properties.getSecurityMode();
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid security mode: " + securityMode + ". Valid modes: off, always, auto");
            return 2;
        }

        ReviewRequest request = new ReviewRequest(
                stateStore.root().getFileName().toString(),
                stateStore.readDocument(ContextPropagator.CONTEXT_PACK).orElse(""),
                stateStore.readDocument("inputs/implementation_summary.md").orElse(""),
                securitySensitive || properties.getReview().isSecuritySensitive(),
                mode);

        ReviewOutcome outcome;
        try {
            outcome = coordinator.review(request, StageContext.of(phase, SessionMode.OFF));
        } catch (JoinBarrierException e) {
            ConsoleOutput.error("Review aborted: " + e.getMessage());
            return 1;
        }
        summaryWriter.write(outcome);

        ConsoleOutput.info("Lenses: " + String.join(", ", outcome.lenses()));
        if (!outcome.timedOutLenses().isEmpty()) {
            ConsoleOutput.error("Timed out: " + String.join(", ", outcome.timedOutLenses()));
        }
        if (!outcome.degradedLenses().isEmpty()) {
            ConsoleOutput.error("Degraded: " + String.join(", ", outcome.degradedLenses()));
        }
        ConsoleOutput.info("Findings: " + outcome.merge().merged().findingCount()
                + " (" + outcome.merge().log().dedupRemoved() + " duplicates removed)");
        ConsoleOutput.info("Fix queue: " + outcome.queue().size() + " items");
        if (outcome.security() != null) {
            ConsoleOutput.securityGate(outcome.security());
        }
        ConsoleOutput.info("Summary written to review/summary.md");

        boolean stopped = outcome.security() != null
                && outcome.security().outcome() == SecurityOutcome.CRITICAL_STOP;
        return stopped || outcome.join().timedOut() ? 1 : 0;
    }
}
