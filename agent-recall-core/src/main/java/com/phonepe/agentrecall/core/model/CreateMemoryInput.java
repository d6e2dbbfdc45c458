package com.phonepe.agentrecall.core.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Input for creating a new memory. Importance and criticality default to 0.5 when not provided.
 */
@Value
@Builder
@Jacksonized
public class CreateMemoryInput {
    @NonNull
    Namespace namespace;
    @NonNull
    String content;
    String contentType;
    @NonNull
    SourceType sourceType;
    @NonNull
    String sourceIdentifier;
    Map<String, Object> sourceMetadata;
    List<String> tags;
    Double importance;
    Double taskCriticality;
    float[] embedding;
    Long ttlSeconds;
    Instant expiresAt;
    String sessionId;
}
