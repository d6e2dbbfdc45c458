package com.phonepe.agentrecall.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of the mutable part of a memory, taken just before it was superseded
 */
@Value
@Builder
@Jacksonized
public class MemoryVersion {
    int version;
    String content;
    String contentType;
    List<String> tags;
    double importance;
    double taskCriticality;
    Instant supersededAt;
    String supersededBy;
    String changeReason;
}
