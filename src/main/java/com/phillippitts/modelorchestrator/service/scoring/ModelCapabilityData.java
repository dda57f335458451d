package com.phillippitts.modelorchestrator.service.scoring;

import com.phillippitts.modelorchestrator.domain.PerformanceRecord;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Record history for one (model, capability) pair.
 *
 * <p>Records are kept in arrival order. {@code lastUpdated} is the timestamp of the newest record,
 * so the decay applied on read depends only on how old the evidence is.
 *
 * <p>Not thread-safe on its own; {@link CapabilityScorer} synchronizes on the instance.
 */
final class ModelCapabilityData {

    private final Deque<PerformanceRecord> records = new ArrayDeque<>();
    private double aggregateScore;
    private Instant lastUpdated;

    void append(PerformanceRecord record) {
        records.addLast(record);
        if (lastUpdated == null || record.timestamp().isAfter(lastUpdated)) {
            lastUpdated = record.timestamp();
        }
    }

    /**
     * Drops records older than {@code cutoff}.
     */
    void pruneBefore(Instant cutoff) {
        Iterator<PerformanceRecord> it = records.iterator();
        while (it.hasNext()) {
            if (it.next().timestamp().isBefore(cutoff)) {
                it.remove();
            }
        }
    }

    int size() {
        return records.size();
    }

    /**
     * Returns the newest {@code n} records, oldest first.
     */
    List<PerformanceRecord> mostRecent(int n) {
        List<PerformanceRecord> all = new ArrayList<>(records);
        return all.subList(Math.max(0, all.size() - n), all.size());
    }

    double aggregateScore() {
        return aggregateScore;
    }

    void aggregateScore(double score) {
        this.aggregateScore = score;
    }

    Instant lastUpdated() {
        return lastUpdated;
    }
}
