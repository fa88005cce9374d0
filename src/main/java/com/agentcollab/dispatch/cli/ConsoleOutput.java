package com.agentcollab.dispatch.cli;

import com.agentcollab.core.events.CollabEvent;
import com.agentcollab.core.model.LastFailure;
import com.agentcollab.core.model.PipelineResult;
import com.agentcollab.core.model.RunStats;
import com.agentcollab.core.model.SecurityGateResult;
import com.agentcollab.core.model.SecurityOutcome;
import com.agentcollab.core.model.StageResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AGENT-COLLAB v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [COLLAB]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void stage(StageResult result) {
        String status = switch (result.status()) {
            case DONE -> "@|fg(green) DONE|@";
            case SKIPPED_DONE -> "@|fg(yellow) SKIPPED|@";
            case FAILED -> "@|fg(red) FAILED|@";
        };
        String detail = result.triage() != null ? " (" + result.triage().errorClass().label() + ")" : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) [STAGE]|@ " + status + " " + result.stageId()
                        + " " + result.tool() + "/" + result.role()
                        + (result.attempts() > 1 ? " after " + result.attempts() + " attempts" : "")
                        + detail));
    }

    public static void pipeline(PipelineResult result) {
        for (StageResult stage : result.stages()) {
            stage(stage);
        }
        System.out.println();
        if (result.failedStage() == null) {
            success("Pipeline " + result.pipelineId() + " complete.");
        } else {
            error("Pipeline " + result.pipelineId() + " stopped at " + result.failedStage() + ".");
            if (result.lastFailure() != null) {
                lastFailure(result.lastFailure());
            }
        }
    }

    public static void lastFailure(LastFailure failure) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red),bold [LAST FAILURE]|@ " + failure.stage() + " class=" + failure.errorClass()
                        + " exit=" + failure.exitCode()));
        if (failure.signature() != null) {
            System.out.println("    signature: " + failure.signature());
        }
        for (String action : failure.suggestedActions()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(yellow) >|@ " + action));
        }
    }

    public static void budgets(RunStats stats, int paidCallBudget) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Budgets|@"));
        String used = stats.paidCallsUsed() >= paidCallBudget
                ? "@|fg(red) " + stats.paidCallsUsed() + "|@"
                : "@|fg(green) " + stats.paidCallsUsed() + "|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Paid calls: " + used + "/" + paidCallBudget));
        System.out.println("  Stages completed: " + stats.stagesCompleted().size());
        System.out.println("  Error signatures: " + stats.signatures().size());
    }

    public static void securityGate(SecurityGateResult result) {
        String label = switch (result.outcome()) {
            case CLEAN -> "@|fg(green),bold [SECURITY CLEAN]|@";
            case WARNING_HIGH_REMAINING -> "@|fg(yellow),bold [SECURITY WARNING]|@";
            case CRITICAL_STOP -> "@|fg(red),bold [SECURITY STOP]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + label + " final severity " + result.finalSeverity()
                        + ", " + result.roundsRun() + " rounds"));
        if (result.outcome() == SecurityOutcome.CRITICAL_STOP) {
            for (String finding : result.criticalFindings()) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(red) -|@ " + finding));
            }
        }
    }

    public static void event(CollabEvent event) {
        String prefix = switch (event.eventType()) {
            case "stage.started", "stage.completed", "stage.skipped" -> "@|fg(blue) [STAGE]|@";
            case "stage.progress" -> "@|fg(white) [HEARTBEAT]|@";
            case "stage.failed" -> "@|fg(red) [STAGE]|@";
            case "review.lens.started", "review.lens.completed" -> "@|fg(magenta) [LENS]|@";
            case "review.lens.degraded", "review.lens.timed_out" -> "@|fg(red) [LENS]|@";
            case "security.round" -> "@|fg(yellow),bold [SECURITY]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.stageId() != null ? event.stageId() : event.phase();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                prefix + " " + event.eventType() + " " + subject
                        + (event.payload().isEmpty() ? "" : " " + event.payload())));
    }
}
