package com.agentcollab.core.review;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Waits for all lens workers against one shared deadline.
 * <p>
 * When the deadline passes, the watchdog cancels every unfinished worker with an interrupt and
 * gives the pool a fixed grace period to wind down, so the barrier returns within
 * {@code timeout + grace}. A worker that fails on its own is reported as degraded.
 */
public final class JoinBarrier {

    private static final Logger log = LoggerFactory.getLogger(JoinBarrier.class);

    private final Duration timeout;
    private final Duration grace;

    public JoinBarrier(Duration timeout, Duration grace) {
        this.timeout = timeout;
        this.grace = grace;
    }

    /**
     * @param executor pool running the workers; shut down before this method returns
     * @param handles  lens name to worker handle, in lens order
     * @param stageIds lens name to the stage id that runs it, used in degraded reports
     * @throws JoinBarrierException when a handle is missing or the caller is interrupted
     */
    public JoinResult await(ExecutorService executor, Map<String, Future<LensReport>> handles,
                            Map<String, String> stageIds) {
        for (Map.Entry<String, Future<LensReport>> entry : handles.entrySet()) {
            if (entry.getValue() == null) {
                executor.shutdownNow();
                throw new JoinBarrierException("No worker handle for lens " + entry.getKey());
            }
        }

        long started = System.nanoTime();
        long deadline = started + timeout.toNanos();
        Map<String, LensReport> reports = new LinkedHashMap<>();
        List<String> timedOut = new ArrayList<>();

        for (Map.Entry<String, Future<LensReport>> entry : handles.entrySet()) {
            String lens = entry.getKey();
            Future<LensReport> future = entry.getValue();
            try {
                reports.put(lens, awaitOne(future, deadline - System.nanoTime()));
            } catch (TimeoutException e) {
                timedOut.add(lens);
            } catch (ExecutionException | CancellationException e) {
                log.warn("Lens {} worker failed: {}", lens, e.toString());
                reports.put(lens, LensReport.degraded(lens, stageIds.getOrDefault(lens, lens), -1));
            } catch (InterruptedException e) {
                handles.values().forEach(f -> f.cancel(true));
                executor.shutdownNow();
                Thread.currentThread().interrupt();
                throw new JoinBarrierException("Interrupted while joining review lenses", e);
            }
        }

        for (String lens : timedOut) {
            log.warn("Lens {} missed the {}s join deadline; cancelling", lens, timeout.toSeconds());
            handles.get(lens).cancel(true);
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Lens workers still running {}s after cancellation", grace.toSeconds());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            throw new JoinBarrierException("Interrupted while waiting for cancelled lenses", e);
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        BarrierStatus status = timedOut.isEmpty() ? BarrierStatus.COMPLETED : BarrierStatus.TIMED_OUT;
        return new JoinResult(status, reports, timedOut, elapsed);
    }

    private static LensReport awaitOne(Future<LensReport> future, long remainingNanos)
            throws InterruptedException, ExecutionException, TimeoutException {
        if (remainingNanos <= 0) {
            if (!future.isDone()) {
                throw new TimeoutException();
            }
            return future.get();
        }
        return future.get(remainingNanos, TimeUnit.NANOSECONDS);
    }
}
