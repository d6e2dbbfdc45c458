package com.phonepe.agentrecall.core.store;

/**
 * Backend failure categories a store can report
 */
public enum StoreErrorCode {
    STORAGE_ERROR,
    QUOTA_EXCEEDED,
    NAMESPACE_NOT_FOUND,
    TIMEOUT,
}
