package com.agentcollab.core.review;

import com.agentcollab.core.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Merges lens outputs into one deduplicated finding list.
 * <p>
 * Dedup key is (target file, {@link FindingParser#issueKey issue key}). On a collision the
 * record with the strictly higher severity replaces the kept one in place, so discovery order
 * is preserved. Finding ids are assigned in final order.
 */
@Component
public class FindingMerger {

    private static final Logger log = LoggerFactory.getLogger(FindingMerger.class);

    /**
     * @param lensOutputs lens name to raw output, iterated in lens order
     */
    public MergeResult merge(String taskName, Map<String, String> lensOutputs) {
        Map<String, Integer> rawCounts = new LinkedHashMap<>();
        List<Finding> raw = new ArrayList<>();
        for (Map.Entry<String, String> entry : lensOutputs.entrySet()) {
            List<Finding> parsed = FindingParser.parse(entry.getKey(), entry.getValue());
            rawCounts.put(entry.getKey(), parsed.size());
            raw.addAll(parsed);
        }

        Map<List<String>, Finding> deduped = new LinkedHashMap<>();
        int dedupRemoved = 0;
        int conflictResolved = 0;
        for (Finding finding : raw) {
            List<String> key = List.of(
                    finding.targetFile().toLowerCase(Locale.ROOT),
                    FindingParser.issueKey(finding.issue()));
            Finding existing = deduped.get(key);
            if (existing == null) {
                deduped.put(key, finding);
                continue;
            }
            dedupRemoved++;
            if (finding.severity().rank() > existing.severity().rank()) {
                deduped.put(key, finding);
                conflictResolved++;
                log.info("Dedup conflict on {}: {} ({}) replaces {} ({})", key.get(0).isEmpty() ? "<no file>" : key.get(0),
                        finding.severity().label(), finding.lens(), existing.severity().label(), existing.lens());
            }
        }

        List<Finding> findings = new ArrayList<>();
        int index = 1;
        for (Finding finding : deduped.values()) {
            findings.add(finding.withId(String.format("F%03d", index++)));
        }
        int evidenceRejected = (int) findings.stream()
                .filter(f -> f.usesExternalEvidence() && f.evidenceIds().isEmpty())
                .count();

        Instant now = Instant.now();
        List<String> lenses = List.copyOf(lensOutputs.keySet());
        MergedFindings merged = new MergedFindings(taskName, lenses.size(), findings.size(), findings, now);
        MergeLog mergeLog = new MergeLog(lenses, rawCounts, dedupRemoved, conflictResolved,
                evidenceRejected, findings.size(), now);
        log.info("Merged {} raw findings from {} lenses into {} ({} duplicates, {} severity conflicts)",
                raw.size(), lenses.size(), findings.size(), dedupRemoved, conflictResolved);
        return new MergeResult(merged, mergeLog);
    }
}
