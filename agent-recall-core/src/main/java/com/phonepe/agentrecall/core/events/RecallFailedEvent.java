package com.phonepe.agentrecall.core.events;

import com.phonepe.agentrecall.core.recall.RecallFailure;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

import java.time.Instant;

@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RecallFailedEvent extends LifecycleEvent {
    RecallFailure failure;

    public RecallFailedEvent(@NonNull String namespaceKey,
                             @NonNull Instant timestamp,
                             @NonNull RecallFailure failure) {
        super(LifecycleEventType.RECALL_FAILED, namespaceKey, null, timestamp);
        this.failure = failure;
    }

    @Override
    public <T> T accept(LifecycleEventVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
