package com.phonepe.agentrecall.core.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Origin descriptor of a memory
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@With
public class MemorySource {
    @NonNull
    SourceType type;
    @NonNull
    String identifier;
    Instant timestamp;
    @Singular("metadataEntry")
    Map<String, Object> metadata;
}
