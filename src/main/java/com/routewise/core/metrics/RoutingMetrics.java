package com.routewise.core.metrics;

import com.routewise.core.model.ComplexityClass;
import com.routewise.core.model.EscalationLevel;
import com.routewise.core.model.ResultStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for routing decisions.
 */
@Service
public class RoutingMetrics {

    private final MeterRegistry registry;

    public RoutingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSelection(ComplexityClass complexity, String primaryProviderId, int secondaryCount) {
        Counter.builder("routewise.selections.total")
                .tag("complexity", complexity.name().toLowerCase(Locale.ROOT))
                .tag("primary", primaryProviderId)
                .register(registry)
                .increment();

        DistributionSummary.builder("routewise.selections.secondaries")
                .description("Secondary providers per plan")
                .register(registry)
                .record(secondaryCount);
    }

    public void recordUnresolved(ComplexityClass complexity) {
        Counter.builder("routewise.selections.unresolved")
                .tag("complexity", complexity.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordExecution(ResultStatus status, Duration executionTime) {
        Timer.builder("routewise.execution.duration")
                .tag("status", status.wireName())
                .register(registry)
                .record(executionTime);
    }

    public void recordReward(double reward) {
        DistributionSummary.builder("routewise.execution.reward")
                .description("Shaped reward per execution record")
                .register(registry)
                .record(reward);
    }

    public void incrementEscalations(EscalationLevel level) {
        Counter.builder("routewise.escalations.total")
                .tag("level", String.valueOf(level.rank()))
                .register(registry)
                .increment();
    }

    public void recordRecommendations(int count) {
        DistributionSummary.builder("routewise.recommendations.count")
                .description("Recommendations returned per query")
                .register(registry)
                .record(count);
    }
}
