package com.agentcollab.core.review;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param status         whether every lens finished before the deadline
 * @param reports        reports of finished lenses, completed or degraded, in lens order
 * @param timedOutLenses lenses cancelled at the deadline
 * @param elapsed        time spent in the barrier, grace included
 */
public record JoinResult(BarrierStatus status, Map<String, LensReport> reports, List<String> timedOutLenses,
                         Duration elapsed) {

    public JoinResult {
        reports = reports == null ? Map.of() : new LinkedHashMap<>(reports);
        timedOutLenses = timedOutLenses == null ? List.of() : List.copyOf(timedOutLenses);
    }

    public boolean timedOut() {
        return status == BarrierStatus.TIMED_OUT;
    }

    public List<String> degradedLenses() {
        return reports.values().stream().filter(LensReport::isDegraded).map(LensReport::lens).toList();
    }
}
