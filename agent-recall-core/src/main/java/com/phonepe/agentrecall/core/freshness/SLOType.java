package com.phonepe.agentrecall.core.freshness;

public enum SLOType {
    FRESHNESS,
    RELEVANCE,
    RECALL,
    CROSS_SESSION,
}
