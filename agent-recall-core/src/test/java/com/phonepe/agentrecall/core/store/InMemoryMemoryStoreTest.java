package com.phonepe.agentrecall.core.store;

import com.phonepe.agentrecall.core.MutableClock;
import com.phonepe.agentrecall.core.TestUtils;
import com.phonepe.agentrecall.core.model.MemoryObject;
import com.phonepe.agentrecall.core.model.MemorySource;
import com.phonepe.agentrecall.core.model.MemoryStatus;
import com.phonepe.agentrecall.core.model.Namespace;
import com.phonepe.agentrecall.core.model.SourceType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static com.phonepe.agentrecall.core.TestUtils.NAMESPACE;
import static com.phonepe.agentrecall.core.TestUtils.OTHER_NAMESPACE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryMemoryStoreTest {
    private final MutableClock clock = new MutableClock();
    private final InMemoryMemoryStore store = new InMemoryMemoryStore(clock);

    @Test
    void testListFiltersAndPages() {
        final var oldest = TestUtils.memory(clock.instant().minus(Duration.ofHours(3)));
        final var middle = TestUtils.memory(clock.instant().minus(Duration.ofHours(2)));
        final var newest = TestUtils.memory(clock.instant().minus(Duration.ofHours(1)));
        final var deleted = TestUtils.memory(clock.instant()).withStatus(MemoryStatus.DELETED);
        final var expired = TestUtils.memory(clock.instant()).withTtlSeconds(0L);
        List.of(oldest, middle, newest, deleted, expired).forEach(store::saveMemory);
        store.saveMemory(TestUtils.memory(clock.instant()).withNamespace(OTHER_NAMESPACE));

        final var active = store.listMemories(NAMESPACE, ListMemoryOptions.active());
        assertEquals(List.of(newest.getMemoryId(), middle.getMemoryId(), oldest.getMemoryId()),
                     active.stream().map(MemoryObject::getMemoryId).toList());

        final var page = store.listMemories(NAMESPACE, ListMemoryOptions.builder()
                .status(MemoryStatus.ACTIVE)
                .order(SortOrder.ASC)
                .offset(1)
                .limit(1)
                .build());
        assertEquals(List.of(middle.getMemoryId()), page.stream().map(MemoryObject::getMemoryId).toList());

        assertEquals(5, store.listMemories(NAMESPACE, ListMemoryOptions.builder().includeExpired(true).build()).size());
        assertEquals(4, store.listMemories(NAMESPACE, ListMemoryOptions.builder().build()).size());
    }

    @Test
    void testSearchFilters() {
        final var tool = TestUtils.memory(clock.instant(), "billing", "refund")
                .withSource(MemorySource.builder().type(SourceType.TOOL_OUTPUT).identifier("crm").build())
                .withImportance(0.9)
                .withSessionId("s1");
        final var user = TestUtils.memory(clock.instant(), "billing")
                .withSource(MemorySource.builder().type(SourceType.USER_INPUT).identifier("u1").build())
                .withImportance(0.2)
                .withSessionId("s2");
        store.saveMemory(tool);
        store.saveMemory(user);
        store.saveMemory(TestUtils.memory(clock.instant(), "billing").withStatus(MemoryStatus.DELETED));

        assertEquals(2, store.searchMemories(query().tags(List.of("billing")).build()).size());
        assertEquals(1, store.searchMemories(query().tags(List.of("billing", "refund")).build()).size());
        assertEquals(1, store.searchMemories(query().sourceTypes(Set.of(SourceType.USER_INPUT)).build()).size());
        assertEquals(1, store.searchMemories(query().minImportance(0.5).build()).size());
        assertEquals(1, store.searchMemories(query().sessionId("s1").build()).size());
        assertEquals(2, store.searchMemories(query().sessionId("s1").includeCrossSession(true).build()).size());
        assertTrue(store.searchMemories(MemoryQuery.builder().namespace(OTHER_NAMESPACE).build()).isEmpty());
    }

    @Test
    void testSearchSimilarity() {
        store.saveMemory(TestUtils.memory(clock.instant()).withContent("refund within five days"));
        final var candidates = store.searchMemories(query().query("refund within ten days").build());
        assertEquals(3.0 / 5, candidates.get(0).getSemanticSimilarity(), 1e-9);
    }

    @Test
    void testExpiryUsesClock() {
        final var memory = TestUtils.memory(clock.instant()).withTtlSeconds(60L);
        store.saveMemory(memory);
        assertEquals(1, store.searchMemories(query().build()).size());
        clock.advance(Duration.ofSeconds(60));
        assertTrue(store.searchMemories(query().build()).isEmpty());
    }

    @Test
    void testQuarantinePartition() {
        final var memory = TestUtils.memory(clock.instant()).withStatus(MemoryStatus.QUARANTINED);
        store.saveQuarantinedMemory(memory);
        assertTrue(store.getMemory(memory.getMemoryId()).isEmpty());
        assertEquals(memory, store.getQuarantinedMemory(memory.getMemoryId()).orElseThrow());
        assertEquals(1, store.listQuarantinedMemories(NAMESPACE, ListOptions.defaults()).size());
        assertTrue(store.namespaceExists(NAMESPACE));
        assertFalse(store.namespaceExists(OTHER_NAMESPACE));
        store.deleteQuarantinedMemory(memory.getMemoryId());
        assertTrue(store.getQuarantinedMemory(memory.getMemoryId()).isEmpty());
    }

    @Test
    void testQuota() {
        final var limited = new InMemoryMemoryStore(clock, 2);
        final var first = TestUtils.memory(clock.instant());
        limited.saveMemory(first);
        limited.saveQuarantinedMemory(TestUtils.memory(clock.instant()));
        limited.saveMemory(first.withContent("updated"));
        final var error = assertThrows(MemoryStoreException.class,
                                       () -> limited.saveMemory(TestUtils.memory(clock.instant())));
        assertEquals(StoreErrorCode.QUOTA_EXCEEDED, error.getErrorCode());
        limited.saveMemory(TestUtils.memory(clock.instant()).withNamespace(OTHER_NAMESPACE));
    }

    @Test
    void testAuditLog() {
        store.logAudit(entry(NAMESPACE));
        clock.advance(Duration.ofSeconds(1));
        store.logAudit(entry(NAMESPACE));
        store.logAudit(entry(OTHER_NAMESPACE));
        final var entries = store.getAuditLog(NAMESPACE, ListOptions.defaults());
        assertEquals(2, entries.size());
        assertNotNull(entries.get(0).getId());
        assertEquals(clock.instant(), entries.get(0).getTimestamp());
        assertTrue(entries.get(0).getTimestamp().isAfter(entries.get(1).getTimestamp()));
    }

    private static MemoryQuery.MemoryQueryBuilder query() {
        return MemoryQuery.builder().namespace(NAMESPACE);
    }

    private static AuditEntry entry(Namespace namespace) {
        return AuditEntry.builder()
                .namespace(namespace)
                .action(AuditAction.READ)
                .resourceType(ResourceType.MEMORY)
                .resourceId("m1")
                .actorId("agent")
                .build();
    }
}
