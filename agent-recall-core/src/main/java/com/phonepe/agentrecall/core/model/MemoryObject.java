package com.phonepe.agentrecall.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * A versioned, provenance tracked fact recorded by or for an agent.
 * <p>
 * Instances are immutable. Lifecycle operations produce a new copy through {@link #toBuilder()}; the provenance trail
 * and the version history are only ever appended to.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@With
public class MemoryObject {
    @NonNull
    String memoryId;
    @NonNull
    Namespace namespace;
    String content;
    String contentType;
    MemorySource source;
    IngestionMetadata ingestion;
    @Singular("provenanceEntry")
    List<ProvenanceEntry> provenance;
    @Singular
    List<String> tags;
    double importance;
    double taskCriticality;
    float[] embedding;
    Instant createdAt;
    Instant lastAccessedAt;
    Long ttlSeconds;
    Instant expiresAt;
    @Singular
    List<String> checkpointRefs;
    @Builder.Default
    int version = 1;
    @Singular
    List<MemoryVersion> previousVersions;
    @Builder.Default
    MemoryStatus status = MemoryStatus.ACTIVE;
    String sessionId;
    @Singular("accessedInSession")
    List<String> accessedInSessions;
    int crossSessionRecallCount;

    @JsonIgnore
    public boolean isDeleted() {
        return status == MemoryStatus.DELETED;
    }

    @JsonIgnore
    public boolean isQuarantined() {
        return status == MemoryStatus.QUARANTINED;
    }

    /**
     * Snapshot of the current mutable state, used before every edit or rollback.
     */
    public MemoryVersion snapshot(Instant supersededAt, String supersededBy, String changeReason) {
        return MemoryVersion.builder()
                .version(version)
                .content(content)
                .contentType(contentType)
                .tags(List.copyOf(tags))
                .importance(importance)
                .taskCriticality(taskCriticality)
                .supersededAt(supersededAt)
                .supersededBy(supersededBy)
                .changeReason(changeReason)
                .build();
    }
}
