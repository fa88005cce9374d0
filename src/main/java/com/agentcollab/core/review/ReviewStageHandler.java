package com.agentcollab.core.review;

import com.agentcollab.config.CollabProperties;
import com.agentcollab.core.engine.ContextPropagator;
import com.agentcollab.core.engine.StageContext;
import com.agentcollab.core.events.CollabEvent;
import com.agentcollab.core.events.EventBus;
import com.agentcollab.core.logging.MdcContext;
import com.agentcollab.core.model.LastFailure;
import com.agentcollab.core.model.SecurityOutcome;
import com.agentcollab.core.model.StageResult;
import com.agentcollab.core.model.StageSpec;
import com.agentcollab.core.model.StageStatus;
import com.agentcollab.core.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Runs a pipeline stage whose role is {@code review} as a parallel review.
 * <p>
 * The stage fails when the security gate stops on a critical finding or when a lens timed out
 * at the join barrier; in both cases the review artifacts are written first. Otherwise the
 * stage is marked done and its artifact is the review summary.
 */
@Component
public class ReviewStageHandler {

    private static final Logger log = LoggerFactory.getLogger(ReviewStageHandler.class);

    public static final String REVIEW_ROLE = "review";
    static final String IMPLEMENTATION_SUMMARY = "inputs/implementation_summary.md";

    private final ParallelReviewCoordinator coordinator;
    private final ReviewSummaryWriter summaryWriter;
    private final StateStore stateStore;
    private final CollabProperties properties;
    private final EventBus eventBus;

    public ReviewStageHandler(ParallelReviewCoordinator coordinator, ReviewSummaryWriter summaryWriter,
                              StateStore stateStore, CollabProperties properties, EventBus eventBus) {
        this.coordinator = coordinator;
        this.summaryWriter = summaryWriter;
        this.stateStore = stateStore;
        this.properties = properties;
        this.eventBus = eventBus;
    }

    public boolean supports(StageSpec stage) {
        return REVIEW_ROLE.equals(stage.role());
    }

    public StageResult handle(StageSpec stage, StageContext context) {
        MdcContext.setStage(context.phase(), stage.stageId(), stage.tool());
        try {
            if (stateStore.hasDoneMarker(stage.stageId())) {
                log.info("Review stage {} already done; skipping", stage.stageId());
                return StageResult.skipped(stage);
            }
            ReviewOutcome outcome = coordinator.review(request(), context);
            String summary = summaryWriter.write(outcome);

            if (outcome.security() != null && outcome.security().outcome() == SecurityOutcome.CRITICAL_STOP) {
                return fail(stage, context, "security_critical",
                        "critical security findings require confirmation", List.of(
                                "Read review/security_gate_result.json and review/summary.md",
                                "Confirm or fix the critical findings, then re-run the review"));
            }
            if (outcome.join().timedOut()) {
                return fail(stage, context, "join_timeout",
                        "lenses timed out at the join barrier: " + outcome.timedOutLenses(), List.of(
                                "Raise agentcollab.review.barrier-timeout-seconds or check the lens tool",
                                "Re-run the review; finished lens stages are skipped"));
            }

            stateStore.writeDoneMarker(stage.stageId(), Instant.now());
            stateStore.updateStats(s -> s.withStageCompleted(stage.stageId()));
            eventBus.publish(CollabEvent.of("stage.completed", context.phase(), stage.stageId(), Map.of()));
            log.info("Review stage {} done", stage.stageId());
            return new StageResult(stage.stageId(), stage.tool(), stage.role(), StageStatus.DONE, summary, null, 0);
        } finally {
            MdcContext.clearStage();
        }
    }

    private ReviewRequest request() {
        return new ReviewRequest(
                stateStore.root().getFileName().toString(),
                stateStore.readDocument(ContextPropagator.CONTEXT_PACK).orElse(""),
                stateStore.readDocument(IMPLEMENTATION_SUMMARY).orElse(""),
                properties.getReview().isSecuritySensitive(),
                properties.getSecurityMode());
    }

    private StageResult fail(StageSpec stage, StageContext context, String failureClass, String reason,
                             List<String> actions) {
        log.error("Review stage {} failed ({}): {}", stage.stageId(), failureClass, reason);
        stateStore.writeLastFailure(new LastFailure(stage.stageId(), stage.tool(), failureClass, null, -1,
                "stop: " + reason, actions, Instant.now()));
        eventBus.publish(CollabEvent.of("stage.failed", context.phase(), stage.stageId(),
                Map.of("class", failureClass)));
        return new StageResult(stage.stageId(), stage.tool(), stage.role(), StageStatus.FAILED, null, null, 0);
    }
}
