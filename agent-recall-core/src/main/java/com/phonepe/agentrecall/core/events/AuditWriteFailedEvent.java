package com.phonepe.agentrecall.core.events;

import com.phonepe.agentrecall.core.store.AuditAction;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

import java.time.Instant;

/**
 * An audit entry could not be written. The operation that triggered it still succeeded.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class AuditWriteFailedEvent extends LifecycleEvent {
    AuditAction action;
    String resourceId;
    String errorMessage;

    public AuditWriteFailedEvent(@NonNull String namespaceKey,
                                 String memoryId,
                                 @NonNull Instant timestamp,
                                 @NonNull AuditAction action,
                                 @NonNull String resourceId,
                                 String errorMessage) {
        super(LifecycleEventType.AUDIT_WRITE_FAILED, namespaceKey, memoryId, timestamp);
        this.action = action;
        this.resourceId = resourceId;
        this.errorMessage = errorMessage;
    }

    @Override
    public <T> T accept(LifecycleEventVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
