package com.phonepe.agentrecall.core.drift;

import com.phonepe.agentrecall.core.model.MemoryObject;
import com.phonepe.agentrecall.core.utils.SimilarityUtils;

import java.time.Clock;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Measures loss of topical coherence across a set of memories using their tags
 */
public class DriftDetector {
    /**
     * Consecutive memories whose tag sets are less similar than this count as a topic change
     */
    public static final double TOPIC_CHANGE_SIMILARITY = 0.3;

    private static final double TOPIC_CHANGE_WEIGHT = 0.4;
    private static final double FRAGMENTATION_WEIGHT = 0.3;
    private static final double INCOHERENCE_WEIGHT = 0.3;

    private final Clock clock;

    public DriftDetector(Clock clock) {
        this.clock = clock;
    }

    public DriftMetrics evaluate(List<MemoryObject> memories) {
        return evaluate(memories, DriftThresholds.DEFAULT);
    }

    public DriftMetrics evaluate(List<MemoryObject> memories, DriftThresholds thresholds) {
        final var effectiveThresholds = Objects.requireNonNullElse(thresholds, DriftThresholds.DEFAULT);
        if (memories.isEmpty()) {
            return DriftMetrics.builder()
                    .driftScore(0)
                    .driftDetected(false)
                    .topicChanges(0)
                    .coherenceScore(1)
                    .fragmentationScore(0)
                    .lastCheckedAt(clock.instant())
                    .build();
        }
        final var sorted = memories.stream()
                .sorted(Comparator.comparing(MemoryObject::getCreatedAt,
                                             Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();
        final var n = sorted.size();
        final var topicChanges = topicChanges(sorted);
        final var fragmentation = fragmentation(sorted);
        final var coherence = coherence(sorted);
        final var topicChangeRate = n > 1 ? (double) topicChanges / (n - 1) : 0.0;
        final var drift = Math.min(1.0,
                                   TOPIC_CHANGE_WEIGHT * topicChangeRate
                                           + FRAGMENTATION_WEIGHT * fragmentation
                                           + INCOHERENCE_WEIGHT * (1 - coherence));
        final var detected = drift > effectiveThresholds.getMaxDriftScore()
                || coherence < effectiveThresholds.getMinCoherenceScore()
                || fragmentation > effectiveThresholds.getMaxFragmentationScore();
        return DriftMetrics.builder()
                .driftScore(drift)
                .driftDetected(detected)
                .topicChanges(topicChanges)
                .coherenceScore(coherence)
                .fragmentationScore(fragmentation)
                .lastCheckedAt(clock.instant())
                .build();
    }

    private static int topicChanges(List<MemoryObject> sorted) {
        int changes = 0;
        for (int i = 1; i < sorted.size(); i++) {
            final var similarity = SimilarityUtils.jaccard(new HashSet<>(sorted.get(i - 1).getTags()),
                                                           new HashSet<>(sorted.get(i).getTags()));
            if (similarity < TOPIC_CHANGE_SIMILARITY) {
                changes++;
            }
        }
        return changes;
    }

    private static double fragmentation(List<MemoryObject> memories) {
        if (memories.size() < 2) {
            return 0.0;
        }
        int isolated = 0;
        for (int i = 0; i < memories.size(); i++) {
            final var tags = memories.get(i).getTags();
            if (tags.isEmpty()) {
                continue;
            }
            boolean shared = false;
            for (int j = 0; j < memories.size() && !shared; j++) {
                shared = i != j && !Collections.disjoint(tags, memories.get(j).getTags());
            }
            if (!shared) {
                isolated++;
            }
        }
        return (double) isolated / memories.size();
    }

    private static double coherence(List<MemoryObject> memories) {
        final Map<String, Integer> frequencies = new HashMap<>();
        memories.forEach(memory -> memory.getTags().forEach(tag -> frequencies.merge(tag, 1, Integer::sum)));
        if (frequencies.isEmpty()) {
            return 0.0;
        }
        final var occurrences = frequencies.values().stream().mapToInt(Integer::intValue).sum();
        final var avgTagFrequency = (double) occurrences / frequencies.size() / memories.size();
        return Math.min(1.0, avgTagFrequency * 2);
    }
}
