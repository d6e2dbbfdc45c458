package com.phonepe.agentrecall.core.store;

import com.phonepe.agentrecall.core.model.MemoryObject;
import com.phonepe.agentrecall.core.model.Namespace;
import com.phonepe.agentrecall.core.model.ProvenanceEntry;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract used by the lifecycle and retrieval layers.
 * <p>
 * A store keeps two partitions: the primary partition holds active and deleted memories, the quarantine partition
 * holds memories that are excluded from retrieval until promoted. Implementations only persist what they are given;
 * they never change a memory on their own.
 */
public interface MemoryStore {

    void saveMemory(MemoryObject memory);

    Optional<MemoryObject> getMemory(String memoryId);

    void updateMemory(MemoryObject memory);

    /**
     * Removes a memory from the primary partition. Only used when a memory moves to the quarantine partition.
     */
    void removeMemory(String memoryId);

    List<MemoryObject> listMemories(Namespace namespace, ListMemoryOptions options);

    /**
     * Finds active, unexpired memories in the primary partition matching the query filters. Ranking and limits are
     * applied by the caller.
     */
    List<MemoryCandidate> searchMemories(MemoryQuery query);

    void saveQuarantinedMemory(MemoryObject memory);

    Optional<MemoryObject> getQuarantinedMemory(String memoryId);

    List<MemoryObject> listQuarantinedMemories(Namespace namespace, ListOptions options);

    void deleteQuarantinedMemory(String memoryId);

    void logAudit(AuditEntry entry);

    List<AuditEntry> getAuditLog(Namespace namespace, ListOptions options);

    /**
     * Provenance trail of a memory from whichever partition holds it. Empty when the memory is unknown.
     */
    default List<ProvenanceEntry> getMemoryAuditLog(String memoryId) {
        return getMemory(memoryId)
                .or(() -> getQuarantinedMemory(memoryId))
                .map(MemoryObject::getProvenance)
                .orElse(List.of());
    }

    /**
     * Whether anything at all was ever stored for the namespace
     */
    default boolean namespaceExists(Namespace namespace) {
        return !listMemories(namespace, ListMemoryOptions.builder().includeExpired(true).limit(1).build()).isEmpty()
                || !listQuarantinedMemories(namespace, ListOptions.builder().limit(1).build()).isEmpty();
    }
}
