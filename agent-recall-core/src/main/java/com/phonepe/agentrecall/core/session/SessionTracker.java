package com.phonepe.agentrecall.core.session;

import com.phonepe.agentrecall.core.drift.DriftDetector;
import com.phonepe.agentrecall.core.drift.DriftMetrics;
import com.phonepe.agentrecall.core.drift.DriftThresholds;
import com.phonepe.agentrecall.core.events.DriftDetectedEvent;
import com.phonepe.agentrecall.core.events.EventBus;
import com.phonepe.agentrecall.core.lifecycle.MemoryLifecycleManager;
import com.phonepe.agentrecall.core.model.MemoryObject;
import com.phonepe.agentrecall.core.model.Namespace;
import com.phonepe.agentrecall.core.store.ListMemoryOptions;
import com.phonepe.agentrecall.core.store.MemoryStore;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Groups the active memories of a namespace by the session they originated in and checks sessions for topic drift.
 * Holds no state of its own; everything is derived from the store on every call.
 */
@Slf4j
public class SessionTracker {
    private final MemoryStore store;
    private final DriftDetector driftDetector;
    private final DriftThresholds defaultThresholds;
    private final EventBus eventBus;
    private final Clock clock;

    @Builder
    public SessionTracker(@NonNull MemoryStore store,
                          DriftThresholds defaultThresholds,
                          EventBus eventBus,
                          Clock clock) {
        this.store = store;
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        this.driftDetector = new DriftDetector(this.clock);
        this.defaultThresholds = Objects.requireNonNullElse(defaultThresholds, DriftThresholds.DEFAULT);
        this.eventBus = Objects.requireNonNullElseGet(eventBus, EventBus::new);
    }

    /**
     * Sessions of the namespace, most recently started first. Memories without a session fall in the default bucket.
     */
    public List<SessionHistoryEntry> sessionHistory(@NonNull Namespace namespace) {
        final Map<String, List<MemoryObject>> bySession = activeMemories(namespace)
                .stream()
                .collect(Collectors.groupingBy(SessionTracker::sessionOf, LinkedHashMap::new, Collectors.toList()));
        return bySession.entrySet()
                .stream()
                .map(entry -> SessionHistoryEntry.builder()
                        .sessionId(entry.getKey())
                        .namespaceKey(namespace.key())
                        .startedAt(entry.getValue()
                                           .stream()
                                           .map(MemoryObject::getCreatedAt)
                                           .filter(Objects::nonNull)
                                           .min(Comparator.naturalOrder())
                                           .orElse(null))
                        .memoryIds(entry.getValue().stream().map(MemoryObject::getMemoryId).toList())
                        .memoryCount(entry.getValue().size())
                        .crossSessionRecalls(entry.getValue()
                                                     .stream()
                                                     .mapToInt(MemoryObject::getCrossSessionRecallCount)
                                                     .sum())
                        .build())
                .sorted(Comparator.comparing(SessionHistoryEntry::getStartedAt,
                                             Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .toList();
    }

    public List<MemoryObject> sessionMemories(@NonNull Namespace namespace, @NonNull String sessionId) {
        return activeMemories(namespace)
                .stream()
                .filter(memory -> sessionId.equals(sessionOf(memory)))
                .toList();
    }

    /**
     * Drift of one session. When the session has no active memories, or no session is named, the whole namespace
     * is evaluated.
     */
    public DriftMetrics driftScore(@NonNull Namespace namespace, String sessionId, DriftThresholds thresholds) {
        final var all = activeMemories(namespace);
        final var inSession = sessionId == null
                              ? all
                              : all.stream().filter(memory -> sessionId.equals(sessionOf(memory))).toList();
        return driftDetector.evaluate(inSession.isEmpty() ? all : inSession,
                                      Objects.requireNonNullElse(thresholds, defaultThresholds));
    }

    /**
     * Evaluates drift and publishes a {@link DriftDetectedEvent} when any threshold is crossed
     */
    public DriftCheck checkDrift(@NonNull Namespace namespace, String sessionId, DriftThresholds thresholds) {
        final var metrics = driftScore(namespace, sessionId, thresholds);
        if (metrics.isDriftDetected()) {
            log.info("Drift detected in {} session {}: drift {}, coherence {}, fragmentation {}",
                     namespace.key(), sessionId, metrics.getDriftScore(), metrics.getCoherenceScore(),
                     metrics.getFragmentationScore());
            eventBus.notify(new DriftDetectedEvent(namespace.key(), clock.instant(), sessionId, metrics));
        }
        return new DriftCheck(metrics.isDriftDetected(), metrics);
    }

    private List<MemoryObject> activeMemories(Namespace namespace) {
        return store.listMemories(namespace, ListMemoryOptions.active());
    }

    private static String sessionOf(MemoryObject memory) {
        return Objects.requireNonNullElse(memory.getSessionId(), MemoryLifecycleManager.DEFAULT_SESSION);
    }
}
