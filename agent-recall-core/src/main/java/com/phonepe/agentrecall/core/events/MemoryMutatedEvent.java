package com.phonepe.agentrecall.core.events;

import com.phonepe.agentrecall.core.model.MemoryStatus;
import com.phonepe.agentrecall.core.model.ProvenanceAction;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

import java.time.Instant;

/**
 * A lifecycle operation changed a memory
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class MemoryMutatedEvent extends LifecycleEvent {
    ProvenanceAction action;
    String actorId;
    int version;
    MemoryStatus status;

    public MemoryMutatedEvent(@NonNull String namespaceKey,
                              @NonNull String memoryId,
                              @NonNull Instant timestamp,
                              @NonNull ProvenanceAction action,
                              @NonNull String actorId,
                              int version,
                              @NonNull MemoryStatus status) {
        super(LifecycleEventType.MEMORY_MUTATED, namespaceKey, memoryId, timestamp);
        this.action = action;
        this.actorId = actorId;
        this.version = version;
        this.status = status;
    }

    @Override
    public <T> T accept(LifecycleEventVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
