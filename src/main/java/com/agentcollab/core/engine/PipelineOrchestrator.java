package com.agentcollab.core.engine;

import com.agentcollab.config.CollabProperties;
import com.agentcollab.core.events.CollabEvent;
import com.agentcollab.core.events.EventBus;
import com.agentcollab.core.logging.MdcContext;
import com.agentcollab.core.model.LastFailure;
import com.agentcollab.core.model.PipelineResult;
import com.agentcollab.core.model.PipelineStatus;
import com.agentcollab.core.model.StagePlan;
import com.agentcollab.core.model.StageResult;
import com.agentcollab.core.model.StageSpec;
import com.agentcollab.core.model.StageStatus;
import com.agentcollab.core.review.JoinBarrierException;
import com.agentcollab.core.review.ReviewStageHandler;
import com.agentcollab.core.session.ConcurrentResumeException;
import com.agentcollab.core.session.SessionContinuityManager;
import com.agentcollab.core.session.SessionMismatchException;
import com.agentcollab.core.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs a resolved stage plan strictly in order on the calling thread.
 * <p>
 * The summary is regenerated after every stage, success or failure, and a last-failure record
 * is written for every failure, including unexpected errors (class {@code internal}). The first
 * failure stops the plan; completed stages are never rolled back, so re-running resumes at the failed stage.
 * Stages whose role is the review role are delegated to the parallel review coordinator.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final StageExecutor stageExecutor;
    private final ReviewStageHandler reviewStageHandler;
    private final SummaryWriter summaryWriter;
    private final StateStore stateStore;
    private final SessionContinuityManager sessions;
    private final CollabProperties properties;
    private final EventBus eventBus;

    public PipelineOrchestrator(StageExecutor stageExecutor, ReviewStageHandler reviewStageHandler,
                                SummaryWriter summaryWriter, StateStore stateStore,
                                SessionContinuityManager sessions, CollabProperties properties,
                                EventBus eventBus) {
        this.stageExecutor = stageExecutor;
        this.reviewStageHandler = reviewStageHandler;
        this.summaryWriter = summaryWriter;
        this.stateStore = stateStore;
        this.sessions = sessions;
        this.properties = properties;
        this.eventBus = eventBus;
    }

    public PipelineResult run(StagePlan plan) {
        return runStages(plan, plan.stages());
    }

    /**
     * Runs one stage of the plan on its own, with the same recording as a full run.
     */
    public PipelineResult runSingle(StagePlan plan, String stageId) {
        return runStages(plan, List.of(plan.stage(stageId)));
    }

    private PipelineResult runStages(StagePlan plan, List<StageSpec> stages) {
        MdcContext.setTask(stateStore.root().getFileName().toString());
        log.info("Running pipeline {} (phase {}, {} stages)", plan.pipelineId(), plan.phase(), stages.size());
        sessions.recordPhaseEvent("phase_init", plan.phase(), Map.of("pipeline", plan.pipelineId()));
        eventBus.publish(CollabEvent.of("pipeline.started", plan.phase(), null,
                Map.of("pipeline", plan.pipelineId(), "stages", stages.size())));

        List<StageResult> results = new ArrayList<>();
        try {
            for (StageSpec stage : stages) {
                StageResult result;
                boolean interrupted = false;
                try {
                    result = runStage(plan, stage);
                } catch (StageInterruptedException e) {
                    // state writes go through interruptible channels; the flag is restored after recording
                    interrupted = Thread.interrupted();
                    recordAbort(stage, "interrupted", e.getMessage(), List.of("Re-run the pipeline to resume"));
                    result = aborted(stage);
                }
                results.add(result);
                summaryWriter.write(plan, results);

                if (!result.succeeded()) {
                    LastFailure failure = stateStore.readLastFailure().orElse(null);
                    sessions.recordStageFailure(plan.phase(), stage.tool(), stage.stageId(),
                            failure != null ? failure.errorClass() : "unknown");
                    log.error("Pipeline {} stopped at stage {}", plan.pipelineId(), stage.stageId());
                    eventBus.publish(CollabEvent.of("pipeline.failed", plan.phase(), stage.stageId(), Map.of()));
                    if (interrupted) {
                        Thread.currentThread().interrupt();
                    }
                    return new PipelineResult(plan.pipelineId(), PipelineStatus.FAILED, results,
                            stage.stageId(), failure);
                }
            }
        } finally {
            MdcContext.clear();
        }

        sessions.recordPhaseEvent("phase_done", plan.phase(), Map.of("pipeline", plan.pipelineId()));
        eventBus.publish(CollabEvent.of("pipeline.completed", plan.phase(), null, Map.of()));
        log.info("Pipeline {} completed", plan.pipelineId());
        return new PipelineResult(plan.pipelineId(), PipelineStatus.COMPLETED, results, null, null);
    }

    private StageResult runStage(StagePlan plan, StageSpec stage) {
        StageContext context = StageContext.of(plan.phase(), properties.getSessionMode());
        try {
            if (reviewStageHandler.supports(stage)) {
                return reviewStageHandler.handle(stage, context);
            }
            return stageExecutor.execute(stage, context);
        } catch (SessionMismatchException e) {
            recordAbort(stage, "session_mismatch", e.getMessage(), List.of(
                    "Read state/session_recovery.md",
                    "Correct sessions/" + e.getPhase() + "/" + e.getTool() + ".json and resume from " + stage.stageId()));
        } catch (BudgetExhaustedException e) {
            recordAbort(stage, "budget_exhausted", e.getMessage(), List.of(
                    "Raise the paid call budget or reset the task stats",
                    "Re-run the pipeline to resume at " + stage.stageId()));
        } catch (ConcurrentResumeException e) {
            recordAbort(stage, "concurrent_resume", e.getMessage(), List.of(
                    "Wait for the stage holding the session to finish",
                    "Do not resume one phase session from two stages at once"));
        } catch (JoinBarrierException e) {
            recordAbort(stage, "join_barrier", e.getMessage(), List.of(
                    "Check the review lens workers in review/findings/",
                    "Re-run the review stage"));
        } catch (StageInterruptedException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Stage {} hit an unexpected error", stage.stageId(), e);
            recordAbort(stage, "internal", e.getClass().getSimpleName() + ": " + e.getMessage(), List.of(
                    "Check the log for the stack trace of " + e.getClass().getSimpleName(),
                    "Re-run the pipeline to resume at " + stage.stageId()));
        }
        return aborted(stage);
    }

    private static StageResult aborted(StageSpec stage) {
        return new StageResult(stage.stageId(), stage.tool(), stage.role(), StageStatus.FAILED, null, null, 0);
    }

    private void recordAbort(StageSpec stage, String failureClass, String reason, List<String> actions) {
        log.error("Stage {} aborted ({}): {}", stage.stageId(), failureClass, reason);
        stateStore.writeLastFailure(new LastFailure(stage.stageId(), stage.tool(), failureClass, null,
                -1, reason, actions, Instant.now()));
    }
}
