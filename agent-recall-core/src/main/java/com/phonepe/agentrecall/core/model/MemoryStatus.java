package com.phonepe.agentrecall.core.model;

/**
 * Lifecycle status of a memory. {@link #DELETED} is terminal.
 */
public enum MemoryStatus {
    ACTIVE,
    QUARANTINED,
    DELETED,
}
