package com.routewise.core.metrics;

import com.routewise.core.model.ComplexityClass;
import com.routewise.core.model.EscalationLevel;
import com.routewise.core.model.ResultStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RoutingMetricsTest {

    private SimpleMeterRegistry registry;
    private RoutingMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RoutingMetrics(registry);
    }

    @Test
    @DisplayName("recordSelection counts by complexity and primary")
    void recordSelection() {
        metrics.recordSelection(ComplexityClass.MEDIUM, "webagent", 1);
        metrics.recordSelection(ComplexityClass.MEDIUM, "webagent", 2);
        metrics.recordSelection(ComplexityClass.SIMPLE, "claude", 0);

        var web = registry.find("routewise.selections.total")
                .tag("complexity", "medium").tag("primary", "webagent").counter();
        var claude = registry.find("routewise.selections.total")
                .tag("complexity", "simple").tag("primary", "claude").counter();

        assertNotNull(web);
        assertNotNull(claude);
        assertEquals(2.0, web.count());
        assertEquals(1.0, claude.count());

        var secondaries = registry.find("routewise.selections.secondaries").summary();
        assertNotNull(secondaries);
        assertEquals(3, secondaries.count());
        assertEquals(3.0, secondaries.totalAmount());
    }

    @Test
    @DisplayName("recordUnresolved increments by complexity tag")
    void recordUnresolved() {
        metrics.recordUnresolved(ComplexityClass.COMPLEX);

        var counter = registry.find("routewise.selections.unresolved").tag("complexity", "complex").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordExecution records by status wire name")
    void recordExecution() {
        metrics.recordExecution(ResultStatus.FAILURE_RESOURCE, Duration.ofMillis(250));
        metrics.recordExecution(ResultStatus.SUCCESS_PERFECT, Duration.ofMillis(40));

        var failed = registry.find("routewise.execution.duration").tag("status", "failure_resource").timer();
        var perfect = registry.find("routewise.execution.duration").tag("status", "success_perfect").timer();

        assertNotNull(failed);
        assertNotNull(perfect);
        assertEquals(1, failed.count());
        assertEquals(1, perfect.count());
    }

    @Test
    @DisplayName("incrementEscalations increments by level rank")
    void incrementEscalations() {
        metrics.incrementEscalations(EscalationLevel.CONSTRUCT_TOOL);

        var counter = registry.find("routewise.escalations.total").tag("level", "3").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("reward and recommendation counts go to distribution summaries")
    void summaries() {
        metrics.recordReward(0.8);
        metrics.recordReward(-0.2);
        metrics.recordRecommendations(4);

        var reward = registry.find("routewise.execution.reward").summary();
        var recommendations = registry.find("routewise.recommendations.count").summary();
        assertNotNull(reward);
        assertNotNull(recommendations);
        assertEquals(2, reward.count());
        assertEquals(4.0, recommendations.totalAmount());
    }
}
