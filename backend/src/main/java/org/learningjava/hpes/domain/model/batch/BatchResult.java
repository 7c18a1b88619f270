package org.learningjava.hpes.domain.model.batch;

import org.learningjava.hpes.domain.model.ExtractionStats;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a repository batch, in request order. Results of completed files stay
 * valid when the batch as a whole timed out or was cancelled.
 */
public record BatchResult(
        String batchId,
        List<FileOutcome> outcomes,
        ExtractionStats stats,
        boolean timedOut,
        boolean cancelled
) {

    public BatchResult {
        outcomes = List.copyOf(outcomes);
    }

    public static BatchResult of(String batchId, List<FileOutcome> outcomes, boolean timedOut, boolean cancelled) {
        ExtractionStats stats = ExtractionStats.EMPTY;
        for (FileOutcome o : outcomes) {
            if (o.isCompleted()) {
                stats = stats.plus(o.result().stats());
            }
        }
        return new BatchResult(batchId, outcomes, stats, timedOut, cancelled);
    }

    public Map<FileStatus, Integer> countsByStatus() {
        Map<FileStatus, Integer> counts = new EnumMap<>(FileStatus.class);
        for (FileStatus s : FileStatus.values()) {
            counts.put(s, 0);
        }
        outcomes.forEach(o -> counts.merge(o.status(), 1, Integer::sum));
        return counts;
    }

    public FileOutcome outcome(String path) {
        return outcomes.stream().filter(o -> o.path().equals(path)).findFirst().orElse(null);
    }
}
