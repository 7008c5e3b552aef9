package com.routewise.core.recommend;

import com.routewise.core.catalog.CapabilityCatalog;
import com.routewise.core.learning.LearningStore;
import com.routewise.core.metrics.RoutingMetrics;
import com.routewise.core.model.CapabilityProvider;
import com.routewise.core.model.LearningWeight;
import com.routewise.core.model.Recommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Suggests replacement providers for a failure context by keyword overlap.
 * <p>
 * Providers whose learned score beats the catalog-wide median get a
 * confidence boost, so a reliable provider outranks an equally matched
 * unproven one. Providers with no overlap are left out; an empty result is
 * a valid answer.
 */
@Service
public class RecommendationMatcher {

    private static final Logger log = LoggerFactory.getLogger(RecommendationMatcher.class);

    private static final Comparator<Recommendation> ORDER = Comparator
            .comparingDouble(Recommendation::confidence).reversed()
            .thenComparing(Comparator.comparingDouble(Recommendation::matchScore).reversed())
            .thenComparing(Recommendation::providerId);

    private final CapabilityCatalog catalog;
    private final LearningStore learningStore;
    private final RecommendProperties properties;
    private final RoutingMetrics metrics;

    public RecommendationMatcher(CapabilityCatalog catalog,
                                 LearningStore learningStore,
                                 RecommendProperties properties,
                                 RoutingMetrics metrics) {
        this.catalog = catalog;
        this.learningStore = learningStore;
        this.properties = properties;
        this.metrics = metrics;
    }

    public List<Recommendation> recommend(String contextText, Collection<String> excludeProviderIds) {
        Set<String> excluded = excludeProviderIds == null ? Set.of() : Set.copyOf(excludeProviderIds);
        Set<String> tokens = KeywordMatcher.tokenize(contextText);
        if (tokens.isEmpty()) {
            metrics.recordRecommendations(0);
            return List.of();
        }

        Map<String, LearningWeight> weights = learningStore.weightsSnapshot();
        OptionalDouble median = medianScore(weights);

        var recommendations = new ArrayList<Recommendation>();
        for (CapabilityProvider provider : catalog.providers()) {
            if (excluded.contains(provider.id())) {
                continue;
            }
            var match = KeywordMatcher.match(provider.keywords(), tokens);
            if (match.score() <= 0.0) {
                continue;
            }
            double confidence = match.score();
            LearningWeight weight = weights.get(provider.id());
            if (median.isPresent() && weight != null && weight.useCount() > 0
                    && weight.averageScore() > median.getAsDouble()) {
                confidence += properties.getReliabilityBoost();
            }
            recommendations.add(new Recommendation(provider.id(), match.score(), match.matched(),
                    provider.description(), confidence));
        }

        recommendations.sort(ORDER);
        List<Recommendation> result = recommendations.size() > properties.getMaxResults()
                ? List.copyOf(recommendations.subList(0, properties.getMaxResults()))
                : List.copyOf(recommendations);
        metrics.recordRecommendations(result.size());
        log.debug("Recommended {} providers (excluding {})", result.size(), excluded);
        return result;
    }

    /**
     * Median learned score over catalog providers that have any history.
     */
    private OptionalDouble medianScore(Map<String, LearningWeight> weights) {
        double[] scores = catalog.providers().stream()
                .map(p -> weights.get(p.id()))
                .filter(w -> w != null && w.useCount() > 0)
                .mapToDouble(LearningWeight::averageScore)
                .sorted()
                .toArray();
        if (scores.length == 0) {
            return OptionalDouble.empty();
        }
        int mid = scores.length / 2;
        return OptionalDouble.of(scores.length % 2 == 1 ? scores[mid] : (scores[mid - 1] + scores[mid]) / 2.0);
    }
}
