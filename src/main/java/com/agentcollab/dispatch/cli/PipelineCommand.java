package com.agentcollab.dispatch.cli;

import com.agentcollab.adapter.StagePlanResolver;
import com.agentcollab.core.engine.PipelineOrchestrator;
import com.agentcollab.core.events.EventBus;
import com.agentcollab.core.model.PipelineResult;
import com.agentcollab.core.model.PipelineStatus;
import com.agentcollab.core.model.StagePlan;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: agent-collab pipeline &lt;pipeline-id&gt;
 * <p>
 * Resolves the pipeline from configuration and runs its stages in order. Stages already
 * marked done are skipped, so re-running after a failure resumes at the failed stage.
 */
@Command(name = "pipeline", mixinStandardHelpOptions = true, description = "Run a configured pipeline")
@Component
public class PipelineCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Pipeline id (agentcollab.pipelines.<id>)")
    private String pipelineId;

    @Option(names = {"--profile", "-p"}, description = "Profile recorded on the resolved plan")
    private String profile;

    @Option(names = {"--events", "-e"}, description = "Print stage and review events as they happen")
    private boolean events;

    private final StagePlanResolver resolver;
    private final PipelineOrchestrator orchestrator;
    private final EventBus eventBus;

    public PipelineCommand(StagePlanResolver resolver, PipelineOrchestrator orchestrator, EventBus eventBus) {
        this.resolver = resolver;
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        StagePlan plan;
        try {
            plan = resolver.resolve(pipelineId, profile);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
        ConsoleOutput.info("Pipeline " + plan.pipelineId() + " (phase " + plan.phase() + ", "
                + plan.stages().size() + " stages)");

        EventBus.Subscription subscription = events ? eventBus.subscribe(plan.phase(), ConsoleOutput::event) : null;
        try {
            PipelineResult result = orchestrator.run(plan);
            ConsoleOutput.pipeline(result);
            return result.status() == PipelineStatus.COMPLETED ? 0 : 1;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }
    }
}
