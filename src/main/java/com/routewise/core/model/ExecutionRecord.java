package com.routewise.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Append-only outcome of running a {@link SelectionPlan}. Corrections are
 * new records, never edits.
 *
 * @param userSatisfaction optional rating in [0,1], {@code null} when the user gave none
 * @param errorDetail      optional error text, {@code null} on success
 */
public record ExecutionRecord(
    String recordId,
    Request request,
    SelectionPlan plan,
    ResultStatus status,
    double score,
    Duration executionTime,
    List<String> providersUsed,
    String errorDetail,
    Double userSatisfaction,
    Instant recordedAt
) {

    public ExecutionRecord {
        Objects.requireNonNull(recordId, "recordId");
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(recordedAt, "recordedAt");
        executionTime = executionTime == null || executionTime.isNegative() ? Duration.ZERO : executionTime;
        providersUsed = providersUsed == null ? List.of() : List.copyOf(providersUsed);
    }

    /**
     * True when the record neither failed nor scored below {@code acceptableScore}.
     */
    public boolean isAcceptable(double acceptableScore) {
        return status.isSuccess() && score >= acceptableScore;
    }
}
