package com.routewise.dispatch.api;

import com.routewise.core.engine.RoutingEngine;
import com.routewise.core.model.ExecutionRecord;
import com.routewise.core.model.FallbackDecision;
import com.routewise.core.model.Recommendation;
import com.routewise.core.model.Request;
import com.routewise.core.model.ResultStatus;
import com.routewise.core.model.SelectionPlan;
import com.routewise.core.recording.UnknownPlanException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for plan selection, outcome reporting, fallback checks and
 * recommendations.
 */
@RestController
@RequestMapping("/api/v1/routing")
public class RoutingController {

    private static final Logger log = LoggerFactory.getLogger(RoutingController.class);

    private final RoutingEngine routingEngine;

    public RoutingController(RoutingEngine routingEngine) {
        this.routingEngine = routingEngine;
    }

    /**
     * POST /api/v1/routing/select. Classifies the text and returns a plan.
     */
    @PostMapping("/select")
    public ResponseEntity<Map<String, Object>> select(@RequestBody SelectRequest body) {
        if (body.text() == null || body.text().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Request text is required"));
        }
        Request request = body.chainId() == null
                ? Request.of(body.text(), body.context())
                : Request.inChain(body.chainId(), body.text(), body.context());
        SelectionPlan plan = routingEngine.route(request);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("request_id", request.requestId());
        result.put("chain_id", request.chainId());
        result.put("resolved", plan.isResolved());
        result.put("plan", plan);
        return ResponseEntity.ok(result);
    }

    /**
     * POST /api/v1/routing/records. Reports the outcome of an issued plan.
     * 404 for a plan this router never issued.
     */
    @PostMapping("/records")
    public ResponseEntity<Map<String, Object>> record(@RequestBody RecordRequest body) {
        if (body.planId() == null || body.planId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "plan_id is required"));
        }
        ResultStatus status;
        try {
            status = ResultStatus.fromWire(body.status());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid status: " + body.status()));
        }

        try {
            ExecutionRecord record = routingEngine.report(
                    body.planId(),
                    status,
                    body.score() == null ? 0.0 : body.score(),
                    Duration.ofMillis(body.executionMs() == null ? 0L : body.executionMs()),
                    body.providersUsed() == null ? List.of() : body.providersUsed(),
                    body.errorDetail(),
                    body.userSatisfaction());
            return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                    "record_id", record.recordId(),
                    "chain_id", record.request().chainId(),
                    "status", record.status().wireName(),
                    "score", record.score()));
        } catch (UnknownPlanException e) {
            log.warn("Rejected report: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * POST /api/v1/routing/fallback. Decides whether a chain should fall back.
     */
    @PostMapping("/fallback")
    public ResponseEntity<Map<String, Object>> fallback(@RequestBody FallbackRequest body) {
        if (body.chainId() == null || body.chainId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "chain_id is required"));
        }
        FallbackDecision decision = routingEngine.checkFallback(body.chainId(),
                body.failedProviderIds() == null ? List.of() : body.failedProviderIds());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("should_fallback", decision.shouldFallback());
        result.put("level", decision.level().rank());
        result.put("strategy", decision.level().name());
        result.put("description", decision.description());
        result.put("recommended_tools", decision.recommendedTools());
        result.put("recommended_services", decision.recommendedServices());
        return ResponseEntity.ok(result);
    }

    /**
     * POST /api/v1/routing/recommendations. Suggests providers for a failure context.
     */
    @PostMapping("/recommendations")
    public ResponseEntity<Map<String, Object>> recommend(@RequestBody RecommendRequest body) {
        List<Recommendation> recommendations = routingEngine.recommend(
                body.context() == null ? "" : body.context(),
                body.exclude() == null ? List.of() : body.exclude());
        return ResponseEntity.ok(Map.of("recommendations", recommendations));
    }

    /**
     * GET /api/v1/routing/statistics. Aggregate learning statistics.
     */
    @GetMapping("/statistics")
    public ResponseEntity<Map<String, Object>> statistics() {
        var stats = routingEngine.statistics();
        Map<String, Object> counts = new LinkedHashMap<>();
        stats.statusCounts().forEach((status, count) -> counts.put(status.wireName(), count));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("total_records", stats.totalRecords());
        result.put("overall_success_rate", stats.overallSuccessRate());
        result.put("status_counts", counts);
        result.put("providers", stats.perProviderWeights());
        return ResponseEntity.ok(result);
    }

    /**
     * GET /api/v1/routing/weights. Current per-provider learning weights.
     */
    @GetMapping("/weights")
    public ResponseEntity<Map<String, Object>> weights() {
        return ResponseEntity.ok(Map.of("weights", routingEngine.weights()));
    }

    /**
     * GET /api/v1/routing/records. Latest records, optionally for one chain.
     */
    @GetMapping("/records")
    public ResponseEntity<Map<String, Object>> records(
            @RequestParam(name = "chain_id", required = false) String chainId,
            @RequestParam(name = "limit", defaultValue = "20") int limit) {
        if (limit <= 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "limit must be positive"));
        }
        List<ExecutionRecord> records = chainId == null
                ? routingEngine.recentRecords(limit)
                : routingEngine.chainRecords(chainId, limit);
        return ResponseEntity.ok(Map.of("records", records));
    }
}
