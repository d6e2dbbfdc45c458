package com.phonepe.agentrecall.core.events;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AccessLevel;
import lombok.Data;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Something noteworthy happened to the memories of a namespace
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(name = LifecycleEventType.Values.MEMORY_MUTATED, value = MemoryMutatedEvent.class),
        @JsonSubTypes.Type(name = LifecycleEventType.Values.AUDIT_WRITE_FAILED, value = AuditWriteFailedEvent.class),
        @JsonSubTypes.Type(name = LifecycleEventType.Values.RECALL_FAILED, value = RecallFailedEvent.class),
        @JsonSubTypes.Type(name = LifecycleEventType.Values.DRIFT_DETECTED, value = DriftDetectedEvent.class),
})
@Data
@RequiredArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class LifecycleEvent {
    private final LifecycleEventType type;
    private final String eventId = UUID.randomUUID().toString();
    private final String namespaceKey;
    private final String memoryId;
    private final Instant timestamp;

    public abstract <T> T accept(final LifecycleEventVisitor<T> visitor);
}
