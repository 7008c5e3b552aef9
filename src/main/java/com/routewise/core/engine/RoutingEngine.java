package com.routewise.core.engine;

import com.routewise.core.fallback.FallbackEscalator;
import com.routewise.core.learning.LearningStore;
import com.routewise.core.logging.MdcContext;
import com.routewise.core.metrics.RoutingMetrics;
import com.routewise.core.model.ExecutionRecord;
import com.routewise.core.model.FallbackDecision;
import com.routewise.core.model.LearningStatistics;
import com.routewise.core.model.LearningWeight;
import com.routewise.core.model.Recommendation;
import com.routewise.core.model.Request;
import com.routewise.core.model.ResultStatus;
import com.routewise.core.model.SelectionPlan;
import com.routewise.core.recommend.RecommendationMatcher;
import com.routewise.core.recording.ExecutionRecordStore;
import com.routewise.core.recording.ExecutionRecorder;
import com.routewise.core.recording.PlanLedger;
import com.routewise.core.recording.UnknownPlanException;
import com.routewise.core.selector.ProviderSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Single entry point used by the REST API and the CLI.
 * <p>
 * Every plan handed out by {@link #route(Request)} is registered so that a
 * later {@link #report} can be tied back to the request it was issued for.
 */
@Service
public class RoutingEngine {

    private static final Logger log = LoggerFactory.getLogger(RoutingEngine.class);

    private final ProviderSelector selector;
    private final PlanLedger planLedger;
    private final ExecutionRecorder recorder;
    private final ExecutionRecordStore recordStore;
    private final LearningStore learningStore;
    private final FallbackEscalator escalator;
    private final RecommendationMatcher recommendationMatcher;
    private final RoutingMetrics metrics;

    public RoutingEngine(ProviderSelector selector,
                         PlanLedger planLedger,
                         ExecutionRecorder recorder,
                         ExecutionRecordStore recordStore,
                         LearningStore learningStore,
                         FallbackEscalator escalator,
                         RecommendationMatcher recommendationMatcher,
                         RoutingMetrics metrics) {
        this.selector = selector;
        this.planLedger = planLedger;
        this.recorder = recorder;
        this.recordStore = recordStore;
        this.learningStore = learningStore;
        this.escalator = escalator;
        this.recommendationMatcher = recommendationMatcher;
        this.metrics = metrics;
    }

    public SelectionPlan route(Request request) {
        MdcContext.setRequest(request);
        try {
            SelectionPlan plan = selector.select(request);
            planLedger.register(request, plan);
            MdcContext.setPlan(request, plan.planId());
            if (plan.isResolved()) {
                metrics.recordSelection(plan.complexity(), plan.primaryProviderId(), plan.secondaryProviderIds().size());
                log.info("Routed {} request to {} (order {}, confidence {})", plan.complexity(),
                        plan.primaryProviderId(), plan.executionOrder(), String.format("%.2f", plan.confidence()));
            } else {
                metrics.recordUnresolved(plan.complexity());
                log.warn("Could not resolve a provider for {} request", plan.complexity());
            }
            return plan;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Records the outcome of a plan previously returned by {@link #route(Request)}.
     *
     * @throws UnknownPlanException if no such plan was issued
     */
    public ExecutionRecord report(String planId, ResultStatus status, double score, Duration executionTime,
                                  List<String> providersUsed, String errorDetail, Double userSatisfaction) {
        PlanLedger.IssuedPlan issued = planLedger.find(planId)
                .orElseThrow(() -> new UnknownPlanException(planId));
        MdcContext.setPlan(issued.request(), planId);
        try {
            return recorder.record(issued.request(), issued.plan(), status, score, executionTime,
                    providersUsed, errorDetail, userSatisfaction);
        } finally {
            MdcContext.clear();
        }
    }

    public FallbackDecision checkFallback(String chainId, Collection<String> failedProviderIds) {
        MdcContext.setChain(chainId);
        try {
            return escalator.check(chainId, failedProviderIds);
        } finally {
            MdcContext.clear();
        }
    }

    public List<Recommendation> recommend(String contextText, Collection<String> excludeProviderIds) {
        return recommendationMatcher.recommend(contextText, excludeProviderIds);
    }

    public LearningStatistics statistics() {
        return learningStore.statistics();
    }

    public Map<String, LearningWeight> weights() {
        return learningStore.weightsSnapshot();
    }

    public List<ExecutionRecord> recentRecords(int limit) {
        return recordStore.recent(limit);
    }

    public List<ExecutionRecord> chainRecords(String chainId, int limit) {
        return recordStore.forChain(chainId, limit);
    }
}
