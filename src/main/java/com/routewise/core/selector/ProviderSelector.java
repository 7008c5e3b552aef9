package com.routewise.core.selector;

import com.routewise.core.catalog.CapabilityCatalog;
import com.routewise.core.learning.LearningStore;
import com.routewise.core.model.CapabilityProvider;
import com.routewise.core.model.ComplexityClass;
import com.routewise.core.model.LearningWeight;
import com.routewise.core.model.ProviderCategory;
import com.routewise.core.model.Request;
import com.routewise.core.model.SelectionPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Turns a request into a {@link SelectionPlan}.
 * <p>
 * The request is classified, the complexity class picks a primary category,
 * and the category is resolved to the provider with the best learned score
 * (then lowest latency, then id). Requests that cue two or more categories
 * get up to {@link SelectorProperties#getMaxSecondaries()} complementary
 * providers. Selection reads a weight snapshot and never mutates anything.
 */
@Service
public class ProviderSelector {

    private static final Logger log = LoggerFactory.getLogger(ProviderSelector.class);

    private final CapabilityCatalog catalog;
    private final RequestClassifier classifier;
    private final SelectorProperties properties;
    private final LearningStore learningStore;
    private final Map<ProviderCategory, CueMatcher> hybridCues = new EnumMap<>(ProviderCategory.class);

    public ProviderSelector(CapabilityCatalog catalog,
                            RequestClassifier classifier,
                            SelectorProperties properties,
                            LearningStore learningStore) {
        this.catalog = catalog;
        this.classifier = classifier;
        this.properties = properties;
        this.learningStore = learningStore;
        properties.getHybridCues().forEach((category, cues) -> hybridCues.put(category, new CueMatcher(cues)));
    }

    /**
     * Selects against the learning store's current snapshot.
     */
    public SelectionPlan select(Request request) {
        return select(request, learningStore.weightsSnapshot());
    }

    public SelectionPlan select(Request request, Map<String, LearningWeight> weights) {
        if (request == null) {
            throw new IllegalArgumentException("Request must not be null");
        }
        String planId = "PLAN-" + UUID.randomUUID().toString().substring(0, 8);
        ComplexityClass complexity = classifier.classify(request.text());
        ProviderCategory primaryCategory = properties.getPrimaryCategory()
                .getOrDefault(complexity, ProviderCategory.GENERATION);

        Comparator<CapabilityProvider> ranking = ranking(weights);
        Optional<CapabilityProvider> primary = best(primaryCategory, Set.of(), ranking);
        if (primary.isEmpty()) {
            log.warn("No provider in category {} for {} request {}; plan is unresolved",
                    primaryCategory, complexity, request.requestId());
            return SelectionPlan.unresolved(planId, request.requestId(), complexity);
        }

        List<CapabilityProvider> secondaries = secondaries(request.text(), primary.get(), ranking);
        List<String> order = executionOrder(primary.get(), secondaries);
        double confidence = confidence(primary.get(), complexity, weights);

        var plan = new SelectionPlan(planId, request.requestId(), complexity, primary.get().id(),
                secondaries.stream().map(CapabilityProvider::id).toList(), order, confidence);
        log.debug("Selected {} (secondaries {}) for {} request {} with confidence {}",
                plan.primaryProviderId(), plan.secondaryProviderIds(), complexity, request.requestId(),
                String.format("%.2f", confidence));
        return plan;
    }

    /**
     * Categories cued by the text, in enum order.
     */
    public Set<ProviderCategory> cuedCategories(String text) {
        var cued = new LinkedHashSet<ProviderCategory>();
        for (ProviderCategory category : ProviderCategory.values()) {
            CueMatcher matcher = hybridCues.get(category);
            if (matcher != null && matcher.matchesAny(text)) {
                cued.add(category);
            }
        }
        return cued;
    }

    private List<CapabilityProvider> secondaries(String text, CapabilityProvider primary,
                                                 Comparator<CapabilityProvider> ranking) {
        Set<ProviderCategory> cued = cuedCategories(text);
        if (cued.size() < 2 || properties.getMaxSecondaries() <= 0) {
            return List.of();
        }
        var picks = new ArrayList<CapabilityProvider>();
        for (ProviderCategory category : cued) {
            if (category == primary.category()) {
                continue;
            }
            best(category, Set.of(primary.id()), ranking).ifPresent(picks::add);
        }
        picks.sort(ranking);
        return picks.size() > properties.getMaxSecondaries()
                ? List.copyOf(picks.subList(0, properties.getMaxSecondaries()))
                : List.copyOf(picks);
    }

    private Optional<CapabilityProvider> best(ProviderCategory category, Set<String> excluded,
                                              Comparator<CapabilityProvider> ranking) {
        return catalog.byCategory(category).stream()
                .filter(p -> !excluded.contains(p.id()))
                .min(ranking);
    }

    /**
     * Search secondaries run first to gather context, then the primary, then the rest.
     */
    private static List<String> executionOrder(CapabilityProvider primary, List<CapabilityProvider> secondaries) {
        var order = new ArrayList<String>();
        secondaries.stream()
                .filter(p -> p.category() == ProviderCategory.SEARCH)
                .forEach(p -> order.add(p.id()));
        order.add(primary.id());
        secondaries.stream()
                .filter(p -> p.category() != ProviderCategory.SEARCH)
                .forEach(p -> order.add(p.id()));
        return order;
    }

    private double confidence(CapabilityProvider primary, ComplexityClass complexity,
                              Map<String, LearningWeight> weights) {
        LearningWeight weight = weights.get(primary.id());
        double successRate = weight == null || weight.useCount() == 0 ? properties.getPrior() : weight.successRate();
        double totalWeight = properties.getSuccessWeight() + properties.getComplexityWeight() + properties.getPriorWeight();
        if (totalWeight <= 0) {
            return clamp(properties.getPrior());
        }
        double blended = (properties.getSuccessWeight() * successRate
                + properties.getComplexityWeight() * (1.0 / complexity.rank())
                + properties.getPriorWeight() * properties.getPrior()) / totalWeight;
        if (complexity == ComplexityClass.SIMPLE) {
            blended = Math.max(blended, properties.getSimpleConfidenceFloor());
        }
        return clamp(blended);
    }

    private Comparator<CapabilityProvider> ranking(Map<String, LearningWeight> weights) {
        return Comparator
                .comparingDouble((CapabilityProvider p) -> -score(weights.get(p.id())))
                .thenComparingDouble(p -> latency(weights.get(p.id())))
                .thenComparing(CapabilityProvider::id);
    }

    private double score(LearningWeight weight) {
        return weight == null || weight.useCount() == 0 ? properties.getPriorScore() : weight.averageScore();
    }

    private static double latency(LearningWeight weight) {
        return weight == null || weight.useCount() == 0 ? Double.MAX_VALUE : weight.averageLatencyMillis();
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
