package com.routewise.core.model;

import java.util.List;

/**
 * Outcome of a fallback check. Transient; never persisted.
 */
public record FallbackDecision(
    boolean shouldFallback,
    EscalationLevel level,
    String description,
    List<String> recommendedTools,
    List<String> recommendedServices
) {

    public FallbackDecision {
        recommendedTools = recommendedTools == null ? List.of() : List.copyOf(recommendedTools);
        recommendedServices = recommendedServices == null ? List.of() : List.copyOf(recommendedServices);
    }

    public static FallbackDecision none() {
        return new FallbackDecision(false, EscalationLevel.NONE, EscalationLevel.NONE.strategy(), List.of(), List.of());
    }
}
