package com.agentcollab.core.engine;

import com.agentcollab.config.CollabProperties;
import com.agentcollab.core.model.LastFailure;
import com.agentcollab.core.model.RunStats;
import com.agentcollab.core.model.StagePlan;
import com.agentcollab.core.model.StageResult;
import com.agentcollab.core.model.StageRun;
import com.agentcollab.core.state.FileStateStore;
import com.agentcollab.core.state.StateStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Regenerates {@code outputs/_summary.md}: one block per attempted stage, the last failure
 * and the budgets. The document is cut to the configured line count with a truncation marker.
 */
@Component
public class SummaryWriter {

    static final String SUMMARY_DOCUMENT = "outputs/_summary.md";
    static final int STDERR_HEAD_LINES = 20;
    static final int STDERR_TAIL_LINES = 20;

    private final StateStore stateStore;
    private final CollabProperties properties;
    private final ObjectMapper objectMapper = FileStateStore.createObjectMapper();

    public SummaryWriter(StateStore stateStore, CollabProperties properties) {
        this.stateStore = stateStore;
        this.properties = properties;
    }

    public String write(StagePlan plan, List<StageResult> results) {
        String summary = truncate(render(plan, results), properties.getSummaryMaxLines());
        stateStore.writeDocument(SUMMARY_DOCUMENT, summary);
        return summary;
    }

    String render(StagePlan plan, List<StageResult> results) {
        var sb = new StringBuilder();
        sb.append("# Task Summary\n\n");
        sb.append("Pipeline: ").append(plan.pipelineId())
                .append(" | Phase: ").append(plan.phase())
                .append(" | Updated: ").append(Instant.now()).append("\n\n");

        for (StageResult result : results) {
            sb.append("### ").append(result.stageId())
                    .append(" (").append(result.tool()).append('/').append(result.role()).append(") - ")
                    .append(result.status().label()).append('\n');
            Optional<StageRun> run = stateStore.readStageRun(result.stageId(), result.tool());
            if (run.isPresent()) {
                sb.append("- exit_code: ").append(run.get().exitCode()).append('\n');
                sb.append("- duration: ").append(run.get().durationSec()).append("s\n");
            }
            if (result.triage() != null) {
                sb.append("- class: ").append(result.triage().errorClass().label())
                        .append(" (").append(result.triage().signature()).append(")\n");
            }
            if (!result.succeeded()) {
                stateStore.readStageDiagnostics(result.stageId(), result.tool())
                        .filter(err -> !err.isBlank())
                        .ifPresent(err -> sb.append("```\n").append(excerpt(err)).append("\n```\n"));
            }
            sb.append('\n');
        }

        Optional<LastFailure> lastFailure = stateStore.readLastFailure();
        if (lastFailure.isPresent() && results.stream().anyMatch(r -> !r.succeeded())) {
            sb.append("## Last Failure\n```json\n").append(toJson(lastFailure.get())).append("\n```\n\n");
        }

        RunStats stats = stateStore.loadStats();
        sb.append("## Budgets\n");
        sb.append("- paid_calls_used: ").append(stats.paidCallsUsed())
                .append(" / ").append(properties.getPaidCallBudget()).append('\n');
        sb.append("- retry_budget: ").append(properties.getRetryBudget()).append('\n');
        return sb.toString();
    }

    /**
     * Head and tail of the diagnostic stream, capped at the configured byte size.
     */
    String excerpt(String diagnostics) {
        String[] lines = diagnostics.strip().split("\n");
        String text;
        if (lines.length <= STDERR_HEAD_LINES + STDERR_TAIL_LINES) {
            text = String.join("\n", lines);
        } else {
            text = String.join("\n", Arrays.copyOfRange(lines, 0, STDERR_HEAD_LINES))
                    + "\n... [" + (lines.length - STDERR_HEAD_LINES - STDERR_TAIL_LINES) + " lines omitted] ...\n"
                    + String.join("\n", Arrays.copyOfRange(lines, lines.length - STDERR_TAIL_LINES, lines.length));
        }
        int max = properties.getMaxOutputBytes();
        return text.length() > max ? text.substring(0, max) + "\n... [truncated] ..." : text;
    }

    static String truncate(String summary, int maxLines) {
        String[] lines = summary.split("\n", -1);
        if (lines.length <= maxLines) {
            return summary;
        }
        return String.join("\n", Arrays.copyOfRange(lines, 0, maxLines))
                + "\n... [" + (lines.length - maxLines) + " lines truncated] ...\n";
    }

    private String toJson(LastFailure failure) {
        try {
            return objectMapper.writeValueAsString(failure);
        } catch (JsonProcessingException e) {
            return failure.toString();
        }
    }
}
