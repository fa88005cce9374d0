package com.agentcollab.core.review;

import com.agentcollab.config.CollabProperties;
import com.agentcollab.core.engine.StageContext;
import com.agentcollab.core.events.CollabEvent;
import com.agentcollab.core.events.EventBus;
import com.agentcollab.core.logging.MdcContext;
import com.agentcollab.core.metrics.CollabMetrics;
import com.agentcollab.core.model.Finding;
import com.agentcollab.core.model.FixQueueItem;
import com.agentcollab.core.model.SecurityGateResult;
import com.agentcollab.core.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the review lenses in parallel, joins them against a shared deadline, merges their
 * findings, works the fix queue and applies the security gate.
 * <p>
 * Each lens worker writes only its own {@code review/findings/<lens>.md}; merged artifacts are
 * written by this class after the join. Lenses that time out are left out of the merge.
 */
@Service
public class ParallelReviewCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ParallelReviewCoordinator.class);

    static final String MERGED_DOCUMENT = "review/review_merged_findings.json";
    static final String MERGE_LOG_DOCUMENT = "review/review_merge_log.json";

    private final LensRunner lensRunner;
    private final FindingMerger merger;
    private final FixQueueExecutor fixQueueExecutor;
    private final SecurityEscalation securityEscalation;
    private final StateStore stateStore;
    private final CollabProperties properties;
    private final EventBus eventBus;
    private final CollabMetrics metrics;

    public ParallelReviewCoordinator(LensRunner lensRunner, FindingMerger merger, FixQueueExecutor fixQueueExecutor,
                                     SecurityEscalation securityEscalation, StateStore stateStore,
                                     CollabProperties properties, EventBus eventBus, CollabMetrics metrics) {
        this.lensRunner = lensRunner;
        this.merger = merger;
        this.fixQueueExecutor = fixQueueExecutor;
        this.securityEscalation = securityEscalation;
        this.stateStore = stateStore;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public ReviewOutcome review(ReviewRequest request, StageContext context) {
        boolean securityEnabled = request.securityEnabled();
        List<String> lenses = LensPrompts.lenses(securityEnabled);
        log.info("Starting parallel review with lenses {} (security mode {})", lenses,
                request.securityMode().label());

        JoinResult join = launchAndJoin(lenses, context);
        metrics.recordJoinBarrier(join.elapsed(), join.timedOut());
        for (String lens : join.timedOutLenses()) {
            metrics.recordLensOutcome(lens, "timed_out");
            eventBus.publish(CollabEvent.of("review.lens.timed_out", context.phase(), lens, Map.of()));
        }
        if (join.timedOut()) {
            log.error("Join barrier timed out; merging without {}", join.timedOutLenses());
        }

        Map<String, String> outputs = new LinkedHashMap<>();
        join.reports().forEach((lens, report) -> outputs.put(lens, report.output()));
        MergeResult merge = merger.merge(request.taskName(), outputs);
        stateStore.writeJson(MERGED_DOCUMENT, merge.merged());
        stateStore.writeJson(MERGE_LOG_DOCUMENT, merge.log());
        metrics.recordMergedFindings(merge.merged().findingCount());

        List<FixQueueItem> queue = fixQueueExecutor.execute(request.taskName(),
                FixQueueBuilder.build(merge.merged().findings()), context);

        SecurityGateResult security = null;
        LensReport securityReport = join.reports().get(LensPrompts.SECURITY);
        if (securityReport != null && !securityReport.isDegraded()) {
            List<Finding> securityFindings = FindingParser.parse(LensPrompts.SECURITY, securityReport.output());
            security = securityEscalation.evaluate(request.securityMode(), securityFindings,
                    properties.getSecurityMaxRounds(), context);
        } else if (securityEnabled) {
            log.warn("Security lens did not complete; security gate not evaluated");
        }

        return new ReviewOutcome(lenses, join, merge, queue, security);
    }

    private JoinResult launchAndJoin(List<String> lenses, StageContext context) {
        int poolSize = Math.max(1, Math.min(properties.getMaxParallelLenses(), lenses.size()));
        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "review-lens-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        Map<String, String> callerMdc = MDC.getCopyOfContextMap();
        String tool = properties.getReview().getReviewTool();
        Map<String, Future<LensReport>> handles = new LinkedHashMap<>();
        Map<String, String> stageIds = new LinkedHashMap<>();
        for (String lens : lenses) {
            stageIds.put(lens, StageLensRunner.stageId(tool, lens, 0));
            handles.put(lens, executor.submit(() -> runLens(lens, context, callerMdc)));
        }
        return new JoinBarrier(properties.getBarrierTimeout(), properties.getWatchdogGrace())
                .await(executor, handles, stageIds);
    }

    private LensReport runLens(String lens, StageContext context, Map<String, String> callerMdc) {
        if (callerMdc != null) {
            MDC.setContextMap(callerMdc);
        }
        MdcContext.setLens(context.phase(), lens);
        try {
            eventBus.publish(CollabEvent.of("review.lens.started", context.phase(), lens, Map.of()));
            LensReport report = lensRunner.run(lens, 0, context);
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Lens {} was cancelled; discarding its output", lens);
                return report;
            }
            stateStore.writeDocument("review/findings/" + lens + ".md", report.output());
            String outcome = report.isDegraded() ? "degraded" : "completed";
            metrics.recordLensOutcome(lens, outcome);
            eventBus.publish(CollabEvent.of("review.lens." + outcome, context.phase(), lens,
                    Map.of("exitCode", report.exitCode())));
            log.info("Lens {} {}", lens, outcome);
            return report;
        } finally {
            MDC.clear();
        }
    }
}
