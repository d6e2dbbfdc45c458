package com.phonepe.agentrecall.core.session;

import com.phonepe.agentrecall.core.MutableClock;
import com.phonepe.agentrecall.core.TestUtils;
import com.phonepe.agentrecall.core.drift.DriftThresholds;
import com.phonepe.agentrecall.core.events.DriftDetectedEvent;
import com.phonepe.agentrecall.core.events.EventBus;
import com.phonepe.agentrecall.core.events.LifecycleEvent;
import com.phonepe.agentrecall.core.model.MemoryObject;
import com.phonepe.agentrecall.core.model.MemoryStatus;
import com.phonepe.agentrecall.core.store.InMemoryMemoryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static com.phonepe.agentrecall.core.TestUtils.NAMESPACE;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionTrackerTest {
    private MutableClock clock;
    private InMemoryMemoryStore store;
    private List<LifecycleEvent> events;
    private SessionTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        store = new InMemoryMemoryStore(clock);
        final var eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.onEvent().connect(events::add);
        tracker = SessionTracker.builder()
                .store(store)
                .eventBus(eventBus)
                .clock(clock)
                .build();
    }

    @Test
    void testSessionHistory() {
        save("s1", 10, "billing");
        save("s1", 9, "billing");
        save("s2", 5, "shipping");
        save(null, 1, "misc");
        store.saveMemory(memory("s2", 4, "shipping").withStatus(MemoryStatus.DELETED));

        final var history = tracker.sessionHistory(NAMESPACE);
        assertEquals(List.of("default", "s2", "s1"),
                     history.stream().map(SessionHistoryEntry::getSessionId).toList());
        final var s1 = history.get(2);
        assertEquals(2, s1.getMemoryCount());
        assertEquals(2, s1.getMemoryIds().size());
        assertEquals(clock.instant().minus(Duration.ofHours(10)), s1.getStartedAt());
        assertEquals(NAMESPACE.key(), s1.getNamespaceKey());
        assertEquals(1, history.get(1).getMemoryCount());
    }

    @Test
    void testCrossSessionRecallsAreSummed() {
        store.saveMemory(memory("s1", 2, "billing").withCrossSessionRecallCount(3));
        store.saveMemory(memory("s1", 1, "billing").withCrossSessionRecallCount(4));
        assertEquals(7, tracker.sessionHistory(NAMESPACE).get(0).getCrossSessionRecalls());
    }

    @Test
    void testSessionMemories() {
        save("s1", 3, "billing");
        save("s2", 2, "shipping");
        save(null, 1, "misc");
        assertEquals(1, tracker.sessionMemories(NAMESPACE, "s1").size());
        assertEquals(1, tracker.sessionMemories(NAMESPACE, "default").size());
        assertTrue(tracker.sessionMemories(NAMESPACE, "s9").isEmpty());
    }

    @Test
    void testDriftAlert() {
        save("s1", 3, "a", "b");
        save("s1", 2, "c", "d");
        save("s1", 1, "e", "f");
        final var check = tracker.checkDrift(NAMESPACE, "s1", null);
        assertTrue(check.isAlert());
        assertEquals(2, check.getMetrics().getTopicChanges());
        await().atMost(5, TimeUnit.SECONDS)
                .until(() -> events.stream()
                        .filter(DriftDetectedEvent.class::isInstance)
                        .map(DriftDetectedEvent.class::cast)
                        .anyMatch(event -> "s1".equals(event.getSessionId())));
    }

    @Test
    void testNoDriftInCoherentSession() {
        save("s1", 3, "billing", "refund");
        save("s1", 2, "billing", "refund");
        save("s2", 1, "x", "y");
        final var check = tracker.checkDrift(NAMESPACE, "s1", DriftThresholds.DEFAULT);
        assertFalse(check.isAlert());
        assertEquals(0.0, check.getMetrics().getDriftScore(), 1e-9);
    }

    @Test
    void testUnknownSessionFallsBackToNamespace() {
        save("s1", 2, "billing");
        save("s2", 1, "shipping");
        final var metrics = tracker.driftScore(NAMESPACE, "missing", null);
        assertEquals(1, metrics.getTopicChanges());
        assertEquals(metrics, tracker.driftScore(NAMESPACE, null, null));
    }

    private MemoryObject save(String sessionId, int hoursAgo, String... tags) {
        final var memory = memory(sessionId, hoursAgo, tags);
        store.saveMemory(memory);
        return memory;
    }

    private MemoryObject memory(String sessionId, int hoursAgo, String... tags) {
        return TestUtils.memory(clock.instant().minus(Duration.ofHours(hoursAgo)), tags).withSessionId(sessionId);
    }
}
