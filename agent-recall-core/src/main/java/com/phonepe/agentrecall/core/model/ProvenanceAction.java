package com.phonepe.agentrecall.core.model;

/**
 * Actions recorded in the provenance trail of a memory
 */
public enum ProvenanceAction {
    CREATED,
    ACCESSED,
    MODIFIED,
    CITED,
    INVALIDATED,
    EDITED,
    DELETED,
    MERGED,
    QUARANTINED,
    ROLLED_BACK,
    EXPIRED,
}
