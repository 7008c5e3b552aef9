package com.routewise.core.model;

import java.util.Map;

/**
 * Read-only summary of everything the learning store has ingested.
 */
public record LearningStatistics(
    long totalRecords,
    double overallSuccessRate,
    Map<ResultStatus, Long> statusCounts,
    Map<String, LearningWeight> perProviderWeights
) {

    public LearningStatistics {
        statusCounts = statusCounts == null ? Map.of() : Map.copyOf(statusCounts);
        perProviderWeights = perProviderWeights == null ? Map.of() : Map.copyOf(perProviderWeights);
    }
}
