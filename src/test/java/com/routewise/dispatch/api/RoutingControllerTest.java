package com.routewise.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.routewise.core.engine.RoutingEngine;
import com.routewise.core.model.ComplexityClass;
import com.routewise.core.model.EscalationLevel;
import com.routewise.core.model.ExecutionRecord;
import com.routewise.core.model.FallbackDecision;
import com.routewise.core.model.LearningStatistics;
import com.routewise.core.model.LearningWeight;
import com.routewise.core.model.Recommendation;
import com.routewise.core.model.Request;
import com.routewise.core.model.ResultStatus;
import com.routewise.core.model.SelectionPlan;
import com.routewise.core.recording.UnknownPlanException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RoutingController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class RoutingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private RoutingEngine routingEngine;

    private static SelectionPlan plan(String requestId) {
        return new SelectionPlan("PLAN-0001", requestId, ComplexityClass.MEDIUM, "webagent",
                List.of("claude"), List.of("webagent", "claude"), 0.85);
    }

    private static ExecutionRecord record(String chainId, ResultStatus status, double score) {
        var request = Request.inChain(chainId, "latest inflation rate", Map.of());
        return new ExecutionRecord("REC-0001", request, plan(request.requestId()), status, score,
                Duration.ofMillis(420), List.of("webagent"), null, null, Instant.now());
    }

    // ── POST /api/v1/routing/select ─────────────────────────────────

    @Test
    @DisplayName("POST /select returns the plan with request and chain ids")
    void selectReturnsPlan() throws Exception {
        when(routingEngine.route(any(Request.class)))
                .thenAnswer(inv -> plan(inv.<Request>getArgument(0).requestId()));

        String body = objectMapper.writeValueAsString(new SelectRequest("What is the latest inflation rate?", null, null));

        mockMvc.perform(post("/api/v1/routing/select")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.request_id", startsWith("REQ-")))
                .andExpect(jsonPath("$.resolved").value(true))
                .andExpect(jsonPath("$.plan.planId").value("PLAN-0001"))
                .andExpect(jsonPath("$.plan.complexity").value("MEDIUM"))
                .andExpect(jsonPath("$.plan.primaryProviderId").value("webagent"))
                .andExpect(jsonPath("$.plan.executionOrder", contains("webagent", "claude")));
    }

    @Test
    @DisplayName("POST /select with chain_id continues that chain")
    void selectContinuesChain() throws Exception {
        when(routingEngine.route(any(Request.class)))
                .thenAnswer(inv -> plan(inv.<Request>getArgument(0).requestId()));

        mockMvc.perform(post("/api/v1/routing/select")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"retry the search\",\"chain_id\":\"CHAIN-7\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.chain_id").value("CHAIN-7"));

        verify(routingEngine).route(argThat(r -> "CHAIN-7".equals(r.chainId())));
    }

    @Test
    @DisplayName("POST /select without text returns 400")
    void selectRequiresText() throws Exception {
        mockMvc.perform(post("/api/v1/routing/select")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Request text is required"));

        verify(routingEngine, never()).route(any());
    }

    // ── POST /api/v1/routing/records ────────────────────────────────

    @Test
    @DisplayName("POST /records returns 201 with the stored record")
    void recordCreated() throws Exception {
        when(routingEngine.report(eq("PLAN-0001"), eq(ResultStatus.SUCCESS_PARTIAL), anyDouble(),
                any(), any(), any(), any()))
                .thenReturn(record("CHAIN-1", ResultStatus.SUCCESS_PARTIAL, 0.5));

        mockMvc.perform(post("/api/v1/routing/records")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"plan_id":"PLAN-0001","status":"success_partial","score":0.5,
                                 "execution_ms":420,"providers_used":["webagent"]}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.record_id").value("REC-0001"))
                .andExpect(jsonPath("$.chain_id").value("CHAIN-1"))
                .andExpect(jsonPath("$.status").value("success_partial"))
                .andExpect(jsonPath("$.score").value(0.5));

        verify(routingEngine).report("PLAN-0001", ResultStatus.SUCCESS_PARTIAL, 0.5, Duration.ofMillis(420),
                List.of("webagent"), null, null);
    }

    @Test
    @DisplayName("POST /records with an unknown status returns 400")
    void recordInvalidStatus() throws Exception {
        mockMvc.perform(post("/api/v1/routing/records")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"plan_id\":\"PLAN-0001\",\"status\":\"kind_of_worked\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid status: kind_of_worked"));
    }

    @Test
    @DisplayName("POST /records without plan_id returns 400")
    void recordRequiresPlan() throws Exception {
        mockMvc.perform(post("/api/v1/routing/records")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"success_perfect\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("plan_id is required"));
    }

    @Test
    @DisplayName("POST /records for a plan never issued returns 404")
    void recordUnknownPlan() throws Exception {
        when(routingEngine.report(eq("PLAN-bogus"), any(), anyDouble(), any(), any(), any(), any()))
                .thenThrow(new UnknownPlanException("PLAN-bogus"));

        mockMvc.perform(post("/api/v1/routing/records")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"plan_id\":\"PLAN-bogus\",\"status\":\"failure_system\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error", containsString("PLAN-bogus")));
    }

    // ── POST /api/v1/routing/fallback ───────────────────────────────

    @Test
    @DisplayName("POST /fallback returns the escalation decision")
    void fallbackDecision() throws Exception {
        when(routingEngine.checkFallback(eq("CHAIN-1"), any()))
                .thenReturn(new FallbackDecision(true, EscalationLevel.SWITCH_CATEGORY,
                        "Switch to a different provider category after 2 consecutive unacceptable results",
                        List.of("newsbot"), List.of("mcp.so")));

        mockMvc.perform(post("/api/v1/routing/fallback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"chain_id\":\"CHAIN-1\",\"failed_provider_ids\":[\"webagent\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.should_fallback").value(true))
                .andExpect(jsonPath("$.level").value(2))
                .andExpect(jsonPath("$.strategy").value("SWITCH_CATEGORY"))
                .andExpect(jsonPath("$.recommended_tools", contains("newsbot")))
                .andExpect(jsonPath("$.recommended_services", contains("mcp.so")));

        verify(routingEngine).checkFallback("CHAIN-1", List.of("webagent"));
    }

    @Test
    @DisplayName("POST /fallback without chain_id returns 400")
    void fallbackRequiresChain() throws Exception {
        mockMvc.perform(post("/api/v1/routing/fallback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"failed_provider_ids\":[\"webagent\"]}"))
                .andExpect(status().isBadRequest());
    }

    // ── POST /api/v1/routing/recommendations ────────────────────────

    @Test
    @DisplayName("POST /recommendations lists ranked recommendations")
    void recommendations() throws Exception {
        when(routingEngine.recommend("timeout fetching news", List.of("webagent")))
                .thenReturn(List.of(new Recommendation("newsbot", 0.5, Set.of("news"), "newsbot provider", 0.6)));

        mockMvc.perform(post("/api/v1/routing/recommendations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"context\":\"timeout fetching news\",\"exclude\":[\"webagent\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recommendations", hasSize(1)))
                .andExpect(jsonPath("$.recommendations[0].providerId").value("newsbot"));
    }

    // ── GET endpoints ───────────────────────────────────────────────

    @Test
    @DisplayName("GET /statistics reports totals and status counts by wire name")
    void statistics() throws Exception {
        when(routingEngine.statistics()).thenReturn(new LearningStatistics(3, 2.0 / 3,
                Map.of(ResultStatus.SUCCESS_PERFECT, 2L, ResultStatus.FAILURE_RESOURCE, 1L),
                Map.of("webagent", new LearningWeight("webagent", 3, 2, 0.7, 350.0))));

        mockMvc.perform(get("/api/v1/routing/statistics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_records").value(3))
                .andExpect(jsonPath("$.status_counts.success_perfect").value(2))
                .andExpect(jsonPath("$.status_counts.failure_resource").value(1))
                .andExpect(jsonPath("$.providers.webagent.useCount").value(3));
    }

    @Test
    @DisplayName("GET /weights returns current weights")
    void weights() throws Exception {
        when(routingEngine.weights()).thenReturn(Map.of("claude", new LearningWeight("claude", 1, 1, 1.0, 80.0)));

        mockMvc.perform(get("/api/v1/routing/weights"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.weights.claude.averageScore").value(1.0));
    }

    @Test
    @DisplayName("GET /records with chain_id returns that chain's records")
    void chainRecords() throws Exception {
        when(routingEngine.chainRecords("CHAIN-1", 5))
                .thenReturn(List.of(record("CHAIN-1", ResultStatus.FAILURE_SYSTEM, 0.0)));

        mockMvc.perform(get("/api/v1/routing/records").param("chain_id", "CHAIN-1").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.records", hasSize(1)))
                .andExpect(jsonPath("$.records[0].status").value("failure_system"));
    }

    @Test
    @DisplayName("GET /records with a non-positive limit returns 400")
    void recordsRejectsLimit() throws Exception {
        mockMvc.perform(get("/api/v1/routing/records").param("limit", "0"))
                .andExpect(status().isBadRequest());
    }
}
