package com.agentcollab.core.review;

import com.agentcollab.config.CollabProperties;
import com.agentcollab.core.engine.StageContext;
import com.agentcollab.core.engine.StageExecutor;
import com.agentcollab.core.model.SessionMode;
import com.agentcollab.core.model.StageResult;
import com.agentcollab.core.model.StageRun;
import com.agentcollab.core.model.StageSpec;
import com.agentcollab.core.model.StageStatus;
import com.agentcollab.core.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs a lens as an ordinary stage of the review tool, with the lens focus and constraints as
 * prompt attachments. Lenses never resume a session so they can run side by side.
 */
@Component
public class StageLensRunner implements LensRunner {

    private static final Logger log = LoggerFactory.getLogger(StageLensRunner.class);

    private final StageExecutor stageExecutor;
    private final StateStore stateStore;
    private final CollabProperties properties;

    public StageLensRunner(StageExecutor stageExecutor, StateStore stateStore, CollabProperties properties) {
        this.stageExecutor = stageExecutor;
        this.stateStore = stateStore;
        this.properties = properties;
    }

    @Override
    public LensReport run(String lens, int round, StageContext context) {
        String tool = properties.getReview().getReviewTool();
        String stageId = stageId(tool, lens, round);
        StageSpec stage = new StageSpec(stageId, tool, "review", null, null,
                properties.getDefaultDeadline(), properties.getDefaultDeadlineMode());
        StageContext lensContext = context.withSessionMode(SessionMode.OFF)
                .withAttachment("Review Lens", lens)
                .withAttachment("Lens Focus", LensPrompts.focus(lens))
                .withAttachment("Constraints", LensPrompts.constraints());
        try {
            StageResult result = stageExecutor.execute(stage, lensContext);
            if (result.status() == StageStatus.SKIPPED_DONE) {
                return LensReport.completed(lens, stageId,
                        stateStore.readDocument("outputs/" + stageId + "." + tool + ".out").orElse(""));
            }
            if (result.succeeded()) {
                return LensReport.completed(lens, stageId, result.artifact());
            }
            int exitCode = stateStore.readStageRun(stageId, tool).map(StageRun::exitCode).orElse(-1);
            return LensReport.degraded(lens, stageId, exitCode);
        } catch (RuntimeException e) {
            log.warn("Lens {} aborted: {}", lens, e.getMessage());
            return LensReport.degraded(lens, stageId, -1);
        }
    }

    static String stageId(String tool, String lens, int round) {
        String base = tool + "_review_" + lens;
        return round > 0 ? base + "_r" + round : base;
    }
}
