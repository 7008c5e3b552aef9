package com.routewise.core.learning;

import com.routewise.core.model.ExecutionRecord;
import com.routewise.core.model.LearningStatistics;
import com.routewise.core.model.LearningWeight;
import com.routewise.core.model.ResultStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Owns the per-provider {@link LearningWeight}s.
 * <p>
 * Weights change only through {@link #ingest(ExecutionRecord)}. Each provider's
 * update is a read-modify-write inside {@link ConcurrentHashMap#compute}, so
 * updates to one provider serialize in submission order while unrelated
 * providers proceed independently. Readers get immutable copies.
 */
@Service
public class LearningStore {

    private static final Logger log = LoggerFactory.getLogger(LearningStore.class);

    private final LearningProperties properties;
    private final ConcurrentHashMap<String, LearningWeight> weights = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ResultStatus, LongAdder> statusCounts = new ConcurrentHashMap<>();
    private final AtomicLong totalRecords = new AtomicLong();
    private final AtomicLong successfulRecords = new AtomicLong();

    public LearningStore(LearningProperties properties) {
        double alpha = properties.getSmoothingFactor();
        if (!(alpha > 0.0 && alpha <= 1.0)) {
            throw new IllegalArgumentException("routewise.learning.smoothing-factor must be in (0,1], got " + alpha);
        }
        this.properties = properties;
    }

    public void ingest(ExecutionRecord record) {
        ResultStatus status = record.status();
        double score = clamp(Math.max(record.score(), status.scoreFloor()));
        double latencyMillis = record.executionTime().toNanos() / 1_000_000.0;

        for (String providerId : record.providersUsed()) {
            weights.compute(providerId, (id, current) ->
                    update(current == null ? LearningWeight.empty(id) : current, status, score, latencyMillis));
        }

        totalRecords.incrementAndGet();
        if (status.isSuccess()) {
            successfulRecords.incrementAndGet();
        }
        statusCounts.computeIfAbsent(status, s -> new LongAdder()).increment();
        log.debug("Ingested record {} ({}) for providers {}", record.recordId(), status.wireName(), record.providersUsed());
    }

    /**
     * Immutable copy of every provider's current weight.
     */
    public Map<String, LearningWeight> weightsSnapshot() {
        return Map.copyOf(weights);
    }

    public LearningStatistics statistics() {
        long total = totalRecords.get();
        double successRate = total == 0 ? 0.0 : (double) successfulRecords.get() / total;
        var counts = new EnumMap<ResultStatus, Long>(ResultStatus.class);
        statusCounts.forEach((status, adder) -> counts.put(status, adder.sum()));
        return new LearningStatistics(total, successRate, counts, weightsSnapshot());
    }

    private LearningWeight update(LearningWeight current, ResultStatus status, double score, double latencyMillis) {
        double alpha = properties.getSmoothingFactor();
        long uses = current.useCount() + 1;
        long successes = current.successCount() + (status.isSuccess() ? 1 : 0);
        double averageScore;
        double averageLatency;
        if (current.useCount() == 0) {
            averageScore = score;
            averageLatency = latencyMillis;
        } else {
            averageScore = alpha * score + (1 - alpha) * current.averageScore();
            averageLatency = alpha * latencyMillis + (1 - alpha) * current.averageLatencyMillis();
        }
        return new LearningWeight(current.providerId(), uses, successes, clamp(averageScore), averageLatency);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
