package com.phonepe.agentrecall.core.store;

import com.phonepe.agentrecall.core.model.Namespace;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Audit log record for access tracking. Id and timestamp are assigned by the store when absent.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@With
public class AuditEntry {
    String id;
    @NonNull
    Namespace namespace;
    @NonNull
    AuditAction action;
    @NonNull
    ResourceType resourceType;
    @NonNull
    String resourceId;
    @NonNull
    String actorId;
    Instant timestamp;
    @Singular("metadataEntry")
    Map<String, Object> metadata;
}
