package com.routewise.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of executing a plan, as reported by the execution layer.
 */
public enum ResultStatus {
    SUCCESS_PERFECT(true),
    SUCCESS_PARTIAL(true),
    SUCCESS_ACCEPTABLE(true),
    /** Malformed or out-of-scope request. */
    FAILURE_USER(false),
    /** Provider invocation crashed. */
    FAILURE_SYSTEM(false),
    /** Catalog or category misconfiguration. */
    FAILURE_CONFIG(false),
    /** Timeout or quota exhaustion. */
    FAILURE_RESOURCE(false);

    private final boolean success;

    ResultStatus(boolean success) {
        this.success = success;
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    /**
     * Lowest score an outcome with this status can count as. A perfect
     * result is worth full marks whatever score the caller attached.
     */
    public double scoreFloor() {
        return this == SUCCESS_PERFECT ? 1.0 : 0.0;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ResultStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Result status is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
