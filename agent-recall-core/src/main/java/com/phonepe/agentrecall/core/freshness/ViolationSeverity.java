package com.phonepe.agentrecall.core.freshness;

public enum ViolationSeverity {
    WARNING,
    CRITICAL,
}
