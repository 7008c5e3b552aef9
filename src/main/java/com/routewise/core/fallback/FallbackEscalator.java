package com.routewise.core.fallback;

import com.routewise.core.metrics.RoutingMetrics;
import com.routewise.core.model.EscalationLevel;
import com.routewise.core.model.ExecutionRecord;
import com.routewise.core.model.FallbackDecision;
import com.routewise.core.model.Recommendation;
import com.routewise.core.recommend.RecommendationMatcher;
import com.routewise.core.recording.ExecutionRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides whether a request chain needs a fallback and how drastic it should be.
 * <p>
 * The level follows the length of the chain's current failure streak (one
 * unacceptable record: level 1, two: level 2, ...) and is remembered per
 * chain so it never drops while the streak lasts. The first acceptable record
 * ends the streak and resets the chain. This class only decides; it never
 * invokes a provider and never throws.
 */
@Service
public class FallbackEscalator {

    private static final Logger log = LoggerFactory.getLogger(FallbackEscalator.class);

    private final ExecutionRecordStore recordStore;
    private final RecommendationMatcher recommendationMatcher;
    private final FallbackProperties properties;
    private final RoutingMetrics metrics;

    /**
     * Highest level issued in a failure streak, keyed by the id of the streak's
     * first record. A {@code null} key means the streak began before the
     * history window.
     */
    private record StreakLevel(String firstRecordId, EscalationLevel level) {

        boolean belongsTo(String streakStart) {
            return streakStart == null || streakStart.equals(firstRecordId);
        }
    }

    private final ConcurrentHashMap<String, StreakLevel> streakLevels = new ConcurrentHashMap<>();

    public FallbackEscalator(ExecutionRecordStore recordStore,
                             RecommendationMatcher recommendationMatcher,
                             FallbackProperties properties,
                             RoutingMetrics metrics) {
        this.recordStore = recordStore;
        this.recommendationMatcher = recommendationMatcher;
        this.properties = properties;
        this.metrics = metrics;
    }

    public FallbackDecision check(String chainId, Collection<String> failedProviderIds) {
        try {
            return decide(chainId, failedProviderIds == null ? Set.of() : Set.copyOf(failedProviderIds));
        } catch (RuntimeException e) {
            log.error("Fallback check failed for chain {}; escalating to manual intervention", chainId, e);
            return new FallbackDecision(true, EscalationLevel.MANUAL_INTERVENTION,
                    EscalationLevel.MANUAL_INTERVENTION.strategy() + " (fallback check failed: " + e.getMessage() + ")",
                    List.of(), List.of());
        }
    }

    /**
     * The level the chain's current streak has reached, {@link EscalationLevel#NONE} if none.
     */
    public EscalationLevel currentLevel(String chainId) {
        if (chainId == null) {
            return EscalationLevel.NONE;
        }
        StreakLevel saved = streakLevels.get(chainId);
        return saved == null ? EscalationLevel.NONE : saved.level();
    }

    private FallbackDecision decide(String chainId, Set<String> failedProviderIds) {
        if (chainId == null || chainId.isBlank()) {
            log.warn("Fallback check without a chain id; nothing to evaluate");
            return FallbackDecision.none();
        }
        List<ExecutionRecord> history = recordStore.forChain(chainId, Math.max(1, properties.getHistoryWindow()));
        if (history.isEmpty()) {
            log.debug("No records for chain {}; nothing to fall back from", chainId);
            return FallbackDecision.none();
        }

        ExecutionRecord latest = history.get(history.size() - 1);
        if (latest.isAcceptable(properties.getAcceptableScore())) {
            if (streakLevels.remove(chainId) != null) {
                log.info("Chain {} recovered; failure streak reset", chainId);
            }
            return FallbackDecision.none();
        }
        if (failedProviderIds.isEmpty()) {
            return FallbackDecision.none();
        }

        int streak = trailingFailures(history);
        EscalationLevel byStreak = EscalationLevel.ofRank(streak);
        String streakStart = streak < history.size() ? history.get(history.size() - streak).recordId() : null;
        EscalationLevel level = streakLevels.compute(chainId, (id, saved) -> {
            if (saved == null || !saved.belongsTo(streakStart)) {
                if (saved != null) {
                    log.info("Chain {} recovered since its last check; failure streak reset", chainId);
                }
                return new StreakLevel(streakStart, byStreak);
            }
            return byStreak.rank() > saved.level().rank() ? new StreakLevel(saved.firstRecordId(), byStreak) : saved;
        }).level();

        String context = latest.errorDetail() == null
                ? latest.request().text()
                : latest.request().text() + " " + latest.errorDetail();
        List<String> tools = recommendationMatcher.recommend(context, failedProviderIds).stream()
                .map(Recommendation::providerId)
                .toList();
        List<String> services = properties.servicesFor(level);

        String description = "%s after %d consecutive unacceptable result%s (last: %s)".formatted(
                level.strategy(), streak, streak == 1 ? "" : "s", latest.status().wireName());

        metrics.incrementEscalations(level);
        log.info("Chain {} escalated to level {} ({} recommended tools, {} services)",
                chainId, level.rank(), tools.size(), services.size());
        return new FallbackDecision(true, level, description, tools, services);
    }

    private int trailingFailures(List<ExecutionRecord> history) {
        int streak = 0;
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).isAcceptable(properties.getAcceptableScore())) {
                break;
            }
            streak++;
        }
        return streak;
    }
}
