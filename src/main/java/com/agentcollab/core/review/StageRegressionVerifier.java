package com.agentcollab.core.review;

import com.agentcollab.config.CollabProperties;
import com.agentcollab.core.engine.ContextPropagator;
import com.agentcollab.core.engine.StageContext;
import com.agentcollab.core.engine.StageExecutor;
import com.agentcollab.core.model.SessionMode;
import com.agentcollab.core.model.StageSpec;
import com.agentcollab.core.state.StateStore;
import org.springframework.stereotype.Component;

/**
 * Runs the verify tool as stage {@code <tool>_security_verify_r<N>} in a fresh session, passing
 * the acceptance commands override when one exists.
 */
@Component
public class StageRegressionVerifier implements RegressionVerifier {

    private final StageExecutor stageExecutor;
    private final StateStore stateStore;
    private final CollabProperties properties;

    public StageRegressionVerifier(StageExecutor stageExecutor, StateStore stateStore,
                                   CollabProperties properties) {
        this.stageExecutor = stageExecutor;
        this.stateStore = stateStore;
        this.properties = properties;
    }

    @Override
    public boolean verify(int round, StageContext context) {
        String tool = properties.getReview().getVerifyTool();
        StageSpec stage = new StageSpec(tool + "_security_verify_r" + round, tool, "verify", null, null,
                properties.getDefaultDeadline(), properties.getDefaultDeadlineMode());
        StageContext fresh = context.withSessionMode(SessionMode.OFF);
        StageContext verifyContext = stateStore.readDocument(ContextPropagator.ACCEPTANCE_OVERRIDE)
                .map(commands -> fresh.withAttachment("Verify Commands", commands))
                .orElse(fresh);
        return stageExecutor.execute(stage, verifyContext).succeeded();
    }
}
