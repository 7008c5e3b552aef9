package com.routewise.core.recording;

import com.routewise.core.learning.LearningStore;
import com.routewise.core.learning.RewardCalculator;
import com.routewise.core.metrics.RoutingMetrics;
import com.routewise.core.model.ExecutionRecord;
import com.routewise.core.model.Request;
import com.routewise.core.model.ResultStatus;
import com.routewise.core.model.SelectionPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Turns an execution report into an {@link ExecutionRecord}: clamps the
 * heuristic scores, persists the record, and feeds it to the learning store.
 * <p>
 * Reports are not deduplicated. Submitting the same report twice creates two
 * records and two learning updates.
 */
@Service
public class ExecutionRecorder {

    private static final Logger log = LoggerFactory.getLogger(ExecutionRecorder.class);

    private final PlanLedger planLedger;
    private final ExecutionRecordStore recordStore;
    private final LearningStore learningStore;
    private final RewardCalculator rewardCalculator;
    private final RoutingMetrics metrics;

    public ExecutionRecorder(PlanLedger planLedger,
                             ExecutionRecordStore recordStore,
                             LearningStore learningStore,
                             RewardCalculator rewardCalculator,
                             RoutingMetrics metrics) {
        this.planLedger = planLedger;
        this.recordStore = recordStore;
        this.learningStore = learningStore;
        this.rewardCalculator = rewardCalculator;
        this.metrics = metrics;
    }

    public ExecutionRecord record(Request request, SelectionPlan plan, ResultStatus status, double score,
                                  Duration executionTime, List<String> providersUsed, String errorDetail) {
        return record(request, plan, status, score, executionTime, providersUsed, errorDetail, null);
    }

    /**
     * @throws UnknownPlanException if {@code plan} was not issued for {@code request}
     */
    public ExecutionRecord record(Request request, SelectionPlan plan, ResultStatus status, double score,
                                  Duration executionTime, List<String> providersUsed, String errorDetail,
                                  Double userSatisfaction) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(status, "status");
        if (!planLedger.isIssued(request, plan)) {
            throw new UnknownPlanException(plan.planId());
        }

        var record = new ExecutionRecord(
                "REC-" + UUID.randomUUID(),
                request,
                plan,
                status,
                clamp("score", score),
                executionTime,
                providersUsed,
                errorDetail,
                userSatisfaction == null ? null : clamp("userSatisfaction", userSatisfaction),
                Instant.now());

        recordStore.append(record);
        learningStore.ingest(record);

        double reward = rewardCalculator.reward(record);
        metrics.recordExecution(status, record.executionTime());
        metrics.recordReward(reward);
        log.info("Recorded {} for plan {} (score {}, {} ms, providers {}, reward {})",
                status.wireName(), plan.planId(), String.format("%.2f", record.score()),
                record.executionTime().toMillis(), record.providersUsed(), String.format("%.3f", reward));
        return record;
    }

    private static double clamp(String field, double value) {
        if (Double.isNaN(value)) {
            log.warn("{} was NaN; recording 0.0", field);
            return 0.0;
        }
        if (value < 0.0 || value > 1.0) {
            double clamped = Math.max(0.0, Math.min(1.0, value));
            log.warn("{} {} outside [0,1]; clamped to {}", field, value, clamped);
            return clamped;
        }
        return value;
    }
}
