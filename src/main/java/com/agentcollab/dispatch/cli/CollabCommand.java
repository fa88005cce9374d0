package com.agentcollab.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 * Routes to subcommands: pipeline, stage, review, status.
 */
@Command(
        name = "agent-collab",
        mixinStandardHelpOptions = true,
        version = "agent-collab 0.1.0",
        description = "Runs staged pipelines of external coding-agent CLIs",
        subcommands = {
                PipelineCommand.class,
                StageCommand.class,
                ReviewCommand.class,
                StatusCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CollabCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
