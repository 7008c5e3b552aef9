package com.routewise.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * The hybrid strategy chosen for one request: a primary provider, ordered
 * secondaries and the intended invocation order.
 */
public record SelectionPlan(
    String planId,
    String requestId,
    ComplexityClass complexity,
    String primaryProviderId,
    List<String> secondaryProviderIds,
    List<String> executionOrder,
    double confidence
) {

    /** Primary id of a plan whose required category had no provider. */
    public static final String UNRESOLVED = "unresolved";

    public SelectionPlan {
        Objects.requireNonNull(planId, "planId");
        Objects.requireNonNull(primaryProviderId, "primaryProviderId");
        secondaryProviderIds = secondaryProviderIds == null ? List.of() : List.copyOf(secondaryProviderIds);
        executionOrder = executionOrder == null ? List.of() : List.copyOf(executionOrder);
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public static SelectionPlan unresolved(String planId, String requestId, ComplexityClass complexity) {
        return new SelectionPlan(planId, requestId, complexity, UNRESOLVED, List.of(), List.of(), 0.0);
    }

    @JsonIgnore
    public boolean isResolved() {
        return !UNRESOLVED.equals(primaryProviderId);
    }
}
