package com.phonepe.agentrecall.core.events;

/**
 * Interface for visiting lifecycle event subclasses to implement type specific behaviour
 */
public interface LifecycleEventVisitor<T> {
    T visit(MemoryMutatedEvent memoryMutated);

    T visit(AuditWriteFailedEvent auditWriteFailed);

    T visit(RecallFailedEvent recallFailed);

    T visit(DriftDetectedEvent driftDetected);
}
