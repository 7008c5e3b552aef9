package com.routewise.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/routing/records.
 *
 * @param status           wire name of the result status, e.g. {@code success_partial}
 * @param userSatisfaction nullable rating in [0,1]
 */
public record RecordRequest(
    @JsonProperty("plan_id") String planId,
    String status,
    Double score,
    @JsonProperty("execution_ms") Long executionMs,
    @JsonProperty("providers_used") List<String> providersUsed,
    @JsonProperty("error_detail") String errorDetail,
    @JsonProperty("user_satisfaction") Double userSatisfaction
) {}
