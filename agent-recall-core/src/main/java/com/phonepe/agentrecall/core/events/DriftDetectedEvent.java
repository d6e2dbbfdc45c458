package com.phonepe.agentrecall.core.events;

import com.phonepe.agentrecall.core.drift.DriftMetrics;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

import java.time.Instant;

/**
 * A drift check on a session crossed one of the configured thresholds
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class DriftDetectedEvent extends LifecycleEvent {
    String sessionId;
    DriftMetrics metrics;

    public DriftDetectedEvent(@NonNull String namespaceKey,
                              @NonNull Instant timestamp,
                              String sessionId,
                              @NonNull DriftMetrics metrics) {
        super(LifecycleEventType.DRIFT_DETECTED, namespaceKey, null, timestamp);
        this.sessionId = sessionId;
        this.metrics = metrics;
    }

    @Override
    public <T> T accept(LifecycleEventVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
