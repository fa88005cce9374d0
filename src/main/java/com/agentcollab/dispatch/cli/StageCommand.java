package com.agentcollab.dispatch.cli;

import com.agentcollab.adapter.StagePlanResolver;
import com.agentcollab.core.engine.PipelineOrchestrator;
import com.agentcollab.core.model.PipelineResult;
import com.agentcollab.core.model.PipelineStatus;
import com.agentcollab.core.model.StagePlan;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: agent-collab stage &lt;pipeline-id&gt; &lt;stage-id&gt;
 * <p>
 * Runs a single stage of a pipeline with the same budgets, session handling and recording
 * as a full run.
 */
@Command(name = "stage", mixinStandardHelpOptions = true, description = "Run one stage of a pipeline")
@Component
public class StageCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Pipeline id")
    private String pipelineId;

    @Parameters(index = "1", description = "Stage id, e.g. codex_plan")
    private String stageId;

    private final StagePlanResolver resolver;
    private final PipelineOrchestrator orchestrator;

    public StageCommand(StagePlanResolver resolver, PipelineOrchestrator orchestrator) {
        this.resolver = resolver;
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        PipelineResult result;
        try {
            StagePlan plan = resolver.resolve(pipelineId, null);
            result = orchestrator.runSingle(plan, stageId);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
        ConsoleOutput.pipeline(result);
        return result.status() == PipelineStatus.COMPLETED ? 0 : 1;
    }
}
