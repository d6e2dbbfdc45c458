package com.phonepe.agentrecall.core.ranking;

import com.phonepe.agentrecall.core.model.MemoryObject;
import com.phonepe.agentrecall.core.utils.SimilarityUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Computes the composite relevance score used to order retrieved memories.
 * <p>
 * Recency is driven by creation time. Access only adds a bounded boost so that memories cannot be kept fresh
 * forever just by being retrieved.
 */
public class RankingEngine {
    public static final Duration CREATED_HALF_LIFE = Duration.ofDays(7);
    public static final Duration ACCESS_HALF_LIFE = Duration.ofHours(84);
    public static final double MAX_ACCESS_BOOST = 0.2;

    private final RankingWeights defaultWeights;
    private final Clock clock;

    public RankingEngine() {
        this(RankingWeights.DEFAULT, Clock.systemUTC());
    }

    public RankingEngine(RankingWeights defaultWeights, Clock clock) {
        this.defaultWeights = Objects.requireNonNullElse(defaultWeights, RankingWeights.DEFAULT);
        this.clock = clock;
    }

    /**
     * Recency in [0,1]. A missing creation time scores 0, a creation time in the future scores 1 and a future
     * access time is ignored.
     */
    public static double recencyScore(Instant createdAt, Instant lastAccessedAt, Instant now) {
        if (createdAt == null) {
            return 0.0;
        }
        final var createdAge = Duration.between(createdAt, now);
        final double createdScore = createdAge.isNegative()
                                    ? 1.0
                                    : decay(createdAge, CREATED_HALF_LIFE);
        if (lastAccessedAt == null) {
            return SimilarityUtils.clamp(createdScore);
        }
        final var accessAge = Duration.between(lastAccessedAt, now);
        if (accessAge.isNegative()) {
            return SimilarityUtils.clamp(createdScore);
        }
        return SimilarityUtils.clamp(createdScore + MAX_ACCESS_BOOST * decay(accessAge, ACCESS_HALF_LIFE));
    }

    public double recencyScore(MemoryObject memory) {
        return recencyScore(memory.getCreatedAt(), memory.getLastAccessedAt(), clock.instant());
    }

    /**
     * Weighted sum of the clamped signals
     */
    public static ScoreComponents components(double taskCriticality,
                                             double semanticSimilarity,
                                             double importance,
                                             double recency,
                                             RankingWeights weights) {
        return ScoreComponents.builder()
                .taskCriticality(weights.getTaskCriticality() * SimilarityUtils.clamp(taskCriticality))
                .semanticSimilarity(weights.getSemanticSimilarity() * SimilarityUtils.clamp(semanticSimilarity))
                .importance(weights.getImportance() * SimilarityUtils.clamp(importance))
                .recency(weights.getRecencyDecay() * SimilarityUtils.clamp(recency))
                .build();
    }

    public ScoredMemory score(MemoryObject memory, double semanticSimilarity) {
        return score(memory, semanticSimilarity, null);
    }

    /**
     * @param weights Override for this call, the engine defaults are used when null
     */
    public ScoredMemory score(MemoryObject memory, double semanticSimilarity, RankingWeights weights) {
        final var effectiveWeights = Objects.requireNonNullElse(weights, defaultWeights);
        final var recency = recencyScore(memory);
        final var components = components(memory.getTaskCriticality(),
                                          semanticSimilarity,
                                          memory.getImportance(),
                                          recency,
                                          effectiveWeights);
        return new ScoredMemory(memory,
                                components.total(),
                                SimilarityUtils.clamp(semanticSimilarity),
                                recency,
                                components);
    }

    /**
     * Sorts by score, highest first. Ties go to the more recently created memory.
     */
    public static List<ScoredMemory> rank(List<ScoredMemory> scored) {
        return scored.stream()
                .sorted(Comparator.comparingDouble(ScoredMemory::getScore)
                                .reversed()
                                .thenComparing(s -> s.getMemory().getCreatedAt(),
                                               Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    private static double decay(Duration age, Duration halfLife) {
        return Math.pow(0.5, (double) age.toMillis() / halfLife.toMillis());
    }
}
