package com.agentcollab.core.review;

import com.agentcollab.config.CollabProperties;
import com.agentcollab.core.engine.StageContext;
import com.agentcollab.core.engine.StageExecutor;
import com.agentcollab.core.model.FixQueueItem;
import com.agentcollab.core.model.FixStatus;
import com.agentcollab.core.model.SessionMode;
import com.agentcollab.core.model.StageResult;
import com.agentcollab.core.model.StageSpec;
import com.agentcollab.core.session.SessionContinuityManager;
import org.springframework.stereotype.Component;

/**
 * Applies fixes by running the fix tool as a stage: one stage per queue item
 * ({@code <tool>_fix_<queueId>}) and one per security round ({@code <tool>_security_fix_r<N>}).
 * Fix stages always start a fresh session and never touch the phase baseline.
 */
@Component
public class StageFixApplier implements FixApplier {

    private final StageExecutor stageExecutor;
    private final SessionContinuityManager sessions;
    private final CollabProperties properties;

    public StageFixApplier(StageExecutor stageExecutor, SessionContinuityManager sessions,
                           CollabProperties properties) {
        this.stageExecutor = stageExecutor;
        this.sessions = sessions;
        this.properties = properties;
    }

    @Override
    public boolean available(StageContext context) {
        String tool = properties.getReview().getFixTool();
        return tool != null && !tool.isBlank() && sessions.probe(context.phase(), tool).binaryFound();
    }

    @Override
    public FixQueueItem apply(FixQueueItem item, StageContext context) {
        String tool = properties.getReview().getFixTool();
        StageContext fixContext = context
                .withSessionMode(SessionMode.OFF)
                .withAttachment("Fix Item", describe(item))
                .withAttachment("Constraints", "- Apply only this fix.\n- Keep the change minimal.\n");
        StageResult result = stageExecutor.execute(stage(tool + "_fix_" + item.queueId()), fixContext);
        if (result.succeeded()) {
            return item.withStatus(FixStatus.APPLIED, "applied by " + result.stageId());
        }
        String reason = result.triage() != null ? result.triage().errorClass().label() : "failed";
        return item.withStatus(FixStatus.FAILED, result.stageId() + ": " + reason);
    }

    @Override
    public boolean applySecurityRound(int round, String findingsJson, StageContext context) {
        String tool = properties.getReview().getFixTool();
        StageContext fixContext = context.withSessionMode(SessionMode.OFF)
                .withAttachment("Security Findings (round " + round + ")", findingsJson);
        return stageExecutor.execute(stage(tool + "_security_fix_r" + round), fixContext).succeeded();
    }

    private StageSpec stage(String stageId) {
        return new StageSpec(stageId, properties.getReview().getFixTool(), "fix", null, null,
                properties.getDefaultDeadline(), properties.getDefaultDeadlineMode());
    }

    static String describe(FixQueueItem item) {
        var sb = new StringBuilder();
        sb.append("- queue_id: ").append(item.queueId()).append('\n');
        sb.append("- finding_id: ").append(item.findingId()).append('\n');
        sb.append("- severity: ").append(item.severity().label()).append('\n');
        if (!item.targetFile().isBlank()) {
            sb.append("- target: ").append(item.targetFile());
            if (!item.targetLocation().isBlank()) {
                sb.append(' ').append(item.targetLocation());
            }
            sb.append('\n');
        }
        sb.append("- action: ").append(item.action()).append('\n');
        return sb.toString();
    }
}
