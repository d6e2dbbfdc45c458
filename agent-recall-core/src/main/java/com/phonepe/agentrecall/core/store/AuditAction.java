package com.phonepe.agentrecall.core.store;

/**
 * Access level actions written to the audit log
 */
public enum AuditAction {
    CREATE,
    READ,
    RESTORE,
    SEARCH,
    DELETE,
    UPDATE,
}
