package com.phonepe.agentrecall.core.store;

public enum ResourceType {
    CHECKPOINT,
    MEMORY,
}
