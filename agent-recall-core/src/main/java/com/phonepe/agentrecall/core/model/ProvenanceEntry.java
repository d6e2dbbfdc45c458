package com.phonepe.agentrecall.core.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * One immutable record of a lifecycle action taken on a memory
 */
@Value
@Builder
@Jacksonized
public class ProvenanceEntry {
    @NonNull
    ProvenanceAction action;
    @NonNull
    String actorId;
    String checkpointId;
    @NonNull
    Instant timestamp;
    String reason;
    Integer version;
    List<String> mergedFrom;
    String previousContent;
}
