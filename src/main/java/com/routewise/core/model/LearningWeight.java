package com.routewise.core.model;

/**
 * Running statistics for one provider. Values are immutable; the learning
 * store replaces a provider's weight as a whole on every update.
 */
public record LearningWeight(
    String providerId,
    long useCount,
    long successCount,
    double averageScore,
    double averageLatencyMillis
) {

    public LearningWeight {
        if (useCount < 0 || successCount < 0 || successCount > useCount) {
            throw new IllegalArgumentException(
                    "Invalid counts for " + providerId + ": uses=" + useCount + ", successes=" + successCount);
        }
    }

    public static LearningWeight empty(String providerId) {
        return new LearningWeight(providerId, 0, 0, 0.0, 0.0);
    }

    public double successRate() {
        return useCount == 0 ? 0.0 : (double) successCount / useCount;
    }
}
