package com.agentcollab.core.engine;

import com.agentcollab.adapter.GateValidator;
import com.agentcollab.adapter.PromptComposer;
import com.agentcollab.adapter.PromptInputs;
import com.agentcollab.adapter.ToolAdapter;
import com.agentcollab.adapter.ToolRequest;
import com.agentcollab.adapter.ToolResponse;
import com.agentcollab.config.CollabProperties;
import com.agentcollab.core.events.CollabEvent;
import com.agentcollab.core.events.EventBus;
import com.agentcollab.core.logging.MdcContext;
import com.agentcollab.core.metrics.CollabMetrics;
import com.agentcollab.core.model.Compaction;
import com.agentcollab.core.model.GateResult;
import com.agentcollab.core.model.LastFailure;
import com.agentcollab.core.model.RetryAction;
import com.agentcollab.core.model.RetryDecision;
import com.agentcollab.core.model.RunStats;
import com.agentcollab.core.model.StageResult;
import com.agentcollab.core.model.StageRun;
import com.agentcollab.core.model.StageSpec;
import com.agentcollab.core.model.StageStatus;
import com.agentcollab.core.model.ToolExitStatus;
import com.agentcollab.core.model.Triage;
import com.agentcollab.core.session.SessionContinuityManager;
import com.agentcollab.core.session.SessionDirective;
import com.agentcollab.core.state.StateStore;
import com.agentcollab.core.triage.ErrorClassifier;
import com.agentcollab.core.triage.RetryPolicy;
import com.agentcollab.core.triage.SignatureNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Executes one stage with idempotency, budget enforcement, session continuity, gating and
 * signature-scoped retries.
 * <p>
 * Per attempt: compose request, session pre-stage decision, budget check and paid-call
 * increment in one step, adapter call with a heartbeat ticker, unconditional meta record, session
 * validation and gate on success, classification and retry decision on failure. A stage with
 * a done-marker is returned as {@link StageStatus#SKIPPED_DONE} without touching anything.
 */
@Service
public class StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(StageExecutor.class);

    static final int EXIT_INTERRUPTED = 130;

    private final StateStore stateStore;
    private final ToolAdapter toolAdapter;
    private final GateValidator gateValidator;
    private final PromptComposer promptComposer;
    private final ErrorClassifier classifier;
    private final RetryPolicy retryPolicy;
    private final SessionContinuityManager sessions;
    private final ContextPropagator contextPropagator;
    private final CollabProperties properties;
    private final EventBus eventBus;
    private final CollabMetrics metrics;

    public StageExecutor(StateStore stateStore, ToolAdapter toolAdapter, GateValidator gateValidator,
                         PromptComposer promptComposer, ErrorClassifier classifier, RetryPolicy retryPolicy,
                         SessionContinuityManager sessions, ContextPropagator contextPropagator,
                         CollabProperties properties, EventBus eventBus, CollabMetrics metrics) {
        this.stateStore = stateStore;
        this.toolAdapter = toolAdapter;
        this.gateValidator = gateValidator;
        this.promptComposer = promptComposer;
        this.classifier = classifier;
        this.retryPolicy = retryPolicy;
        this.sessions = sessions;
        this.contextPropagator = contextPropagator;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * @throws BudgetExhaustedException    when the paid-call budget is used up before an attempt
     * @throws com.agentcollab.core.session.SessionMismatchException when the call broke session continuity
     * @throws com.agentcollab.core.session.ConcurrentResumeException when another stage holds the session
     * @throws StageInterruptedException   when the calling thread was interrupted during the tool call
     */
    public StageResult execute(StageSpec stage, StageContext context) {
        MdcContext.setStage(context.phase(), stage.stageId(), stage.tool());
        try {
            if (stateStore.hasDoneMarker(stage.stageId())) {
                log.info("Stage {} already done; skipping", stage.stageId());
                publish("stage.skipped", context, stage, Map.of("reason", "done-marker"));
                return StageResult.skipped(stage);
            }
            return runAttempts(stage, context);
        } finally {
            MdcContext.clearStage();
        }
    }

    private StageResult runAttempts(StageSpec stage, StageContext context) {
        Compaction compaction = Compaction.NORMAL;
        boolean compactionEscalated = false;
        int attempts = 0;

        while (true) {
            String prompt = promptComposer.compose(stage, loadInputs(context), compaction);
            String requestSha = SignatureNormalizer.sha256(prompt);
            SessionDirective directive = sessions.beforeStage(context.phase(), stage.tool(),
                    stage.stageId(), context.sessionMode());
            try {
                reservePaidCall(stage);
                attempts++;
                publish("stage.started", context, stage, Map.of("attempt", attempts));
                ToolResponse response = invokeAndRecord(stage, context, prompt, requestSha, directive);

                GateResult gate = GateResult.notRun();
                if (response.exitStatus().isSuccess()) {
                    sessions.afterStage(directive, response);
                    gate = gateValidator.validate(response.artifact(), stage.role());
                }

                if (response.exitStatus().isSuccess() && gate.passed()) {
                    completeStage(stage, context, response.artifact());
                    return new StageResult(stage.stageId(), stage.tool(), stage.role(),
                            StageStatus.DONE, response.artifact(), null, attempts);
                }

                Triage triage = classifier.classify(response.exitStatus(), response.exitCode(),
                        response.diagnostics(), gate);
                RunStats stats = stateStore.updateStats(s -> s.withSignature(triage.errorClass(),
                        triage.signature(), Instant.now()));
                int count = stats.signatureCount(triage.signature());
                RetryDecision decision = retryPolicy.decide(triage, count, properties.getRetryBudget(),
                        compactionEscalated);

                recordFailure(stage, context, triage, decision);

                if (!decision.shouldRetry()) {
                    return new StageResult(stage.stageId(), stage.tool(), stage.role(),
                            StageStatus.FAILED, null, triage, attempts);
                }
                if (decision.action() == RetryAction.RETRY_COMPACTED) {
                    compaction = Compaction.AGGRESSIVE;
                    compactionEscalated = true;
                }
                metrics.recordRetry(triage.errorClass().label());
                log.info("Retrying stage {}: {}", stage.stageId(), decision.reason());
            } finally {
                sessions.release(directive);
            }
        }
    }

    /**
     * Checks the budget and counts the paid call in one stats mutation, so concurrent stages
     * can never overrun it. The call is counted whether or not the tool then succeeds.
     */
    private void reservePaidCall(StageSpec stage) {
        int budget = properties.getPaidCallBudget();
        RunStats stats = stateStore.updateStats(s -> {
            if (s.paidCallsUsed() >= budget) {
                log.error("Paid call budget exhausted ({}/{}); refusing to run {}",
                        s.paidCallsUsed(), budget, stage.stageId());
                throw new BudgetExhaustedException(stage.stageId(), s.paidCallsUsed(), budget);
            }
            return s.withPaidCall();
        });
        metrics.incrementPaidCalls(stage.tool());
        log.info("Stage {}: paid call {}/{}", stage.stageId(), stats.paidCallsUsed(), budget);
    }

    /**
     * Calls the adapter and records the attempt: meta record and raw outputs.
     * Recording happens before an interruption is re-raised so the attempt is never lost.
     */
    private ToolResponse invokeAndRecord(StageSpec stage, StageContext context, String prompt,
                                         String requestSha, SessionDirective directive) {
        ToolRequest request = new ToolRequest(stage.stageId(), stage.tool(), prompt, stage.model(),
                stage.reasoningEffort(), stage.deadline(), stage.deadlineMode(), directive.resumeSessionId());

        Instant start = Instant.now();
        ToolResponse response;
        InterruptedException interruption = null;
        try {
            response = invokeWithHeartbeat(request, context, stage, start);
        } catch (InterruptedException e) {
            interruption = e;
            response = ToolResponse.failure(ToolExitStatus.GENERAL_FAILURE, EXIT_INTERRUPTED,
                    "interrupted: tool call cancelled");
        }
        Instant end = Instant.now();
        Duration elapsed = Duration.between(start, end);

        stateStore.writeStageRun(new StageRun(stage.stageId(), stage.tool(), response.exitCode(),
                response.exitStatus(), start, end, elapsed.toSeconds(), requestSha));
        stateStore.writeStageOutput(stage.stageId(), stage.tool(), response.artifact(), response.diagnostics());
        metrics.recordStageAttempt(stage.tool(), response.exitStatus().name(), elapsed);
        log.info("Stage {} attempt finished: exit={} ({}) in {}s",
                stage.stageId(), response.exitCode(), response.exitStatus(), elapsed.toSeconds());

        if (interruption != null) {
            Thread.currentThread().interrupt();
            throw new StageInterruptedException(stage.stageId(), interruption);
        }
        return response;
    }

    private ToolResponse invokeWithHeartbeat(ToolRequest request, StageContext context, StageSpec stage,
                                             Instant start) throws InterruptedException {
        long interval = Math.max(1, properties.getHeartbeatInterval().toSeconds());
        ScheduledExecutorService heartbeat = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "heartbeat-" + stage.stageId());
            t.setDaemon(true);
            return t;
        });
        try {
            heartbeat.scheduleAtFixedRate(() -> {
                long elapsed = Duration.between(start, Instant.now()).toSeconds();
                log.info("Stage {} still running ({}s elapsed)", stage.stageId(), elapsed);
                publish("stage.progress", context, stage, Map.of("elapsedSeconds", elapsed));
            }, interval, interval, TimeUnit.SECONDS);
            return toolAdapter.invoke(request);
        } finally {
            heartbeat.shutdownNow();
        }
    }

    private void completeStage(StageSpec stage, StageContext context, String artifact) {
        stateStore.writeDoneMarker(stage.stageId(), Instant.now());
        stateStore.updateStats(s -> s.withStageCompleted(stage.stageId()));
        if (contextPropagator.mutatesContext(stage.role())) {
            contextPropagator.propagate(stage.stageId(), artifact);
        }
        log.info("Stage {} done", stage.stageId());
        publish("stage.completed", context, stage, Map.of());
    }

    private void recordFailure(StageSpec stage, StageContext context, Triage triage, RetryDecision decision) {
        stateStore.writeLastFailure(new LastFailure(stage.stageId(), stage.tool(),
                triage.errorClass().label(), triage.signature(), triage.exitCode(), decision.reason(),
                triage.suggestedActions(), Instant.now()));
        metrics.recordStageFailure(triage.errorClass().label());
        log.warn("Stage {} failed: class={} signature={} decision={} ({})", stage.stageId(),
                triage.errorClass().label(), triage.signature(), decision.action(), decision.reason());
        publish("stage.failed", context, stage, Map.of(
                "class", triage.errorClass().label(),
                "signature", triage.signature(),
                "decision", decision.action().name()));
    }

    private PromptInputs loadInputs(StageContext context) {
        return new PromptInputs(
                stateStore.readDocument("inputs/user_request.md").orElse(""),
                stateStore.readDocument(ContextPropagator.CONTEXT_PACK).orElse(""),
                context.attachments());
    }

    private void publish(String type, StageContext context, StageSpec stage, Map<String, Object> payload) {
        eventBus.publish(CollabEvent.of(type, context.phase(), stage.stageId(), payload));
    }
}
