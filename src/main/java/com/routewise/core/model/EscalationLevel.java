package com.routewise.core.model;

/**
 * Tiers of fallback, from invisible retries to a human.
 */
public enum EscalationLevel {
    NONE(0, "No fallback needed"),
    RETRY_SAME_CATEGORY(1, "Retry with an alternate provider of the same category"),
    SWITCH_CATEGORY(2, "Switch to a different provider category"),
    CONSTRUCT_TOOL(3, "Use a code/tool-execution provider to build a bespoke solution"),
    MANUAL_INTERVENTION(4, "Escalate to manual intervention");

    private final int rank;
    private final String strategy;

    EscalationLevel(int rank, String strategy) {
        this.rank = rank;
        this.strategy = strategy;
    }

    public int rank() {
        return rank;
    }

    public String strategy() {
        return strategy;
    }

    /** The next tier; manual intervention is terminal. */
    public EscalationLevel next() {
        return this == MANUAL_INTERVENTION ? this : values()[ordinal() + 1];
    }

    public static EscalationLevel ofRank(int rank) {
        if (rank <= 0) {
            return NONE;
        }
        return values()[Math.min(rank, MANUAL_INTERVENTION.rank)];
    }

    /** Levels from 3 up are shown to the end user. */
    public boolean isUserVisible() {
        return rank >= CONSTRUCT_TOOL.rank;
    }
}
