package com.agentcollab.dispatch.cli;

import com.agentcollab.config.CollabProperties;
import com.agentcollab.core.model.RunStats;
import com.agentcollab.core.model.SessionRecord;
import com.agentcollab.core.state.StateStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Optional;

/**
 * CLI command: agent-collab status
 * <p>
 * Shows budgets, the last failure and recorded phase sessions for the task directory.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show task budgets and last failure")
@Component
public class StatusCommand implements Runnable {

    @Option(names = {"--summary", "-s"}, description = "Also print outputs/_summary.md")
    private boolean summary;

    private final StateStore stateStore;
    private final CollabProperties properties;

    public StatusCommand(StateStore stateStore, CollabProperties properties) {
        this.stateStore = stateStore;
        this.properties = properties;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Task: " + stateStore.root());
        System.out.println();

        RunStats stats = stateStore.loadStats();
        ConsoleOutput.budgets(stats, properties.getPaidCallBudget());

        if (!stats.signatures().isEmpty()) {
            System.out.println();
            System.out.printf("  %-20s %-6s %s%n", "CLASS", "COUNT", "SIGNATURE");
            System.out.println("  " + "-".repeat(64));
            stats.signatures().values().forEach(s ->
                    System.out.printf("  %-20s %-6d %s%n", s.errorClass().label(), s.count(), s.signature()));
        }

        properties.getPipelines().forEach((id, pipeline) -> {
            String phase = pipeline.getPhase() != null ? pipeline.getPhase() : id;
            for (String tool : properties.getTools().keySet()) {
                Optional<SessionRecord> record = stateStore.readSession(phase, tool);
                record.ifPresent(r -> ConsoleOutput.info(String.format("Session %s/%s: %s (%s, %s)",
                        r.phase(), r.tool(), r.sessionId(), r.status(), r.confidence())));
            }
        });

        System.out.println();
        stateStore.readLastFailure().ifPresentOrElse(
                ConsoleOutput::lastFailure,
                () -> ConsoleOutput.success("No failures recorded."));

        if (summary) {
            System.out.println();
            System.out.println(stateStore.readDocument("outputs/_summary.md").orElse("(no summary yet)"));
        }
    }
}
