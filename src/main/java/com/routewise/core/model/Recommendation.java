package com.routewise.core.model;

import java.util.Set;

/**
 * A catalog provider suggested for a failure context.
 */
public record Recommendation(
    String providerId,
    double matchScore,
    Set<String> matchedKeywords,
    String description,
    double confidence
) {

    public Recommendation {
        matchScore = Math.max(0.0, Math.min(1.0, matchScore));
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        matchedKeywords = matchedKeywords == null ? Set.of() : Set.copyOf(matchedKeywords);
    }
}
