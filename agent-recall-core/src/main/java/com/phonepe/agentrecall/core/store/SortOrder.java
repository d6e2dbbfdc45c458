package com.phonepe.agentrecall.core.store;

/**
 * Sort order on creation/record time for list operations
 */
public enum SortOrder {
    ASC,
    DESC,
}
