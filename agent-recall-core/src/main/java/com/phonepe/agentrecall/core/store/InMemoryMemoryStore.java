package com.phonepe.agentrecall.core.store;

import com.phonepe.agentrecall.core.model.MemoryObject;
import com.phonepe.agentrecall.core.model.Namespace;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reference store keeping everything on the heap. Data is lost when the process exits.
 */
@Slf4j
public class InMemoryMemoryStore implements MemoryStore {
    private final Map<String, MemoryObject> memories = new ConcurrentHashMap<>();
    private final Map<String, MemoryObject> quarantined = new ConcurrentHashMap<>();
    private final List<AuditEntry> auditLog = new ArrayList<>();
    private final Clock clock;
    private final int maxMemoriesPerNamespace;

    public InMemoryMemoryStore() {
        this(Clock.systemUTC(), Integer.MAX_VALUE);
    }

    public InMemoryMemoryStore(Clock clock) {
        this(clock, Integer.MAX_VALUE);
    }

    /**
     * @param clock                   Clock used for expiry checks and audit timestamps
     * @param maxMemoriesPerNamespace Quota on memories held per namespace across both partitions
     */
    public InMemoryMemoryStore(Clock clock, int maxMemoriesPerNamespace) {
        this.clock = clock;
        this.maxMemoriesPerNamespace = maxMemoriesPerNamespace;
    }

    @Override
    public void saveMemory(MemoryObject memory) {
        checkQuota(memory);
        memories.put(memory.getMemoryId(), memory);
    }

    @Override
    public Optional<MemoryObject> getMemory(String memoryId) {
        return Optional.ofNullable(memories.get(memoryId));
    }

    @Override
    public void updateMemory(MemoryObject memory) {
        memories.put(memory.getMemoryId(), memory);
    }

    @Override
    public void removeMemory(String memoryId) {
        memories.remove(memoryId);
    }

    @Override
    public List<MemoryObject> listMemories(Namespace namespace, ListMemoryOptions options) {
        final var now = clock.instant();
        return memories.values()
                .stream()
                .filter(memory -> MemoryMatchers.inNamespace(memory, namespace))
                .filter(memory -> MemoryMatchers.matchesListOptions(memory, options, now))
                .sorted(MemoryMatchers.byCreatedAt(options.getOrder()))
                .skip(options.getOffset())
                .limit(options.getLimit())
                .toList();
    }

    @Override
    public List<MemoryCandidate> searchMemories(MemoryQuery query) {
        final var now = clock.instant();
        return memories.values()
                .stream()
                .filter(memory -> MemoryMatchers.matchesQuery(memory, query, now))
                .map(memory -> MemoryCandidate.of(memory, MemoryMatchers.similarity(memory, query)))
                .toList();
    }

    @Override
    public void saveQuarantinedMemory(MemoryObject memory) {
        checkQuota(memory);
        quarantined.put(memory.getMemoryId(), memory);
    }

    @Override
    public Optional<MemoryObject> getQuarantinedMemory(String memoryId) {
        return Optional.ofNullable(quarantined.get(memoryId));
    }

    @Override
    public List<MemoryObject> listQuarantinedMemories(Namespace namespace, ListOptions options) {
        return quarantined.values()
                .stream()
                .filter(memory -> MemoryMatchers.inNamespace(memory, namespace))
                .sorted(MemoryMatchers.byCreatedAt(options.getOrder()))
                .skip(options.getOffset())
                .limit(options.getLimit())
                .toList();
    }

    @Override
    public void deleteQuarantinedMemory(String memoryId) {
        quarantined.remove(memoryId);
    }

    @Override
    public void logAudit(AuditEntry entry) {
        final var stored = entry.toBuilder()
                .id(entry.getId() == null ? UUID.randomUUID().toString() : entry.getId())
                .timestamp(entry.getTimestamp() == null ? clock.instant() : entry.getTimestamp())
                .build();
        synchronized (auditLog) {
            auditLog.add(stored);
        }
    }

    @Override
    public List<AuditEntry> getAuditLog(Namespace namespace, ListOptions options) {
        final Comparator<AuditEntry> ascending = Comparator.comparing(AuditEntry::getTimestamp);
        synchronized (auditLog) {
            return auditLog.stream()
                    .filter(entry -> entry.getNamespace().key().equals(namespace.key()))
                    .sorted(options.getOrder() == SortOrder.ASC ? ascending : ascending.reversed())
                    .skip(options.getOffset())
                    .limit(options.getLimit())
                    .toList();
        }
    }

    /**
     * Drops everything. Meant for tests.
     */
    public void clear() {
        memories.clear();
        quarantined.clear();
        synchronized (auditLog) {
            auditLog.clear();
        }
    }

    private void checkQuota(MemoryObject memory) {
        if (maxMemoriesPerNamespace == Integer.MAX_VALUE
                || memories.containsKey(memory.getMemoryId())
                || quarantined.containsKey(memory.getMemoryId())) {
            return;
        }
        final var key = memory.getNamespace().key();
        final var held = memories.values().stream().filter(m -> m.getNamespace().key().equals(key)).count()
                + quarantined.values().stream().filter(m -> m.getNamespace().key().equals(key)).count();
        if (held >= maxMemoriesPerNamespace) {
            log.warn("Memory quota of {} exhausted for namespace {}", maxMemoriesPerNamespace, key);
            throw new MemoryStoreException(StoreErrorCode.QUOTA_EXCEEDED,
                                           "Memory quota of %d exceeded for namespace %s"
                                                   .formatted(maxMemoriesPerNamespace, key));
        }
    }
}
